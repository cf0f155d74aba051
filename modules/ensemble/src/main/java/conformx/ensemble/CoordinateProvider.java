// ******************************************************************************
//
// Title:       ConformX.
// Description: ConformX - Software for Conformational Ensemble Analysis.
// Copyright:   Copyright (c) Michael J. Schnieders 2001-2025.
//
// This file is part of ConformX.
//
// ConformX is free software; you can redistribute it and/or modify it
// under the terms of the GNU General Public License version 3 as published by
// the Free Software Foundation.
//
// ConformX is distributed in the hope that it will be useful, but WITHOUT
// ANY WARRANTY; without even the implied warranty of MERCHANTABILITY or FITNESS
// FOR A PARTICULAR PURPOSE. See the GNU General Public License for more
// details.
//
// You should have received a copy of the GNU General Public License along with
// ConformX; if not, write to the Free Software Foundation, Inc., 59 Temple
// Place, Suite 330, Boston, MA 02111-1307 USA
//
// Linking this library statically or dynamically with other modules is making a
// combined work based on this library. Thus, the terms and conditions of the
// GNU General Public License cover the whole combination.
//
// As a special exception, the copyright holders of this library give you
// permission to link this library with independent modules to produce an
// executable, regardless of the license terms of these independent modules, and
// to copy and distribute the resulting executable under terms of your choice,
// provided that you also meet, for each linked independent module, the terms
// and conditions of the license of that module. An independent module is a
// module which is not derived from or based on this library. If you modify this
// library, you may extend this exception to your version of the library, but
// you are not obligated to do so. If you do not wish to do so, delete this
// exception statement from your version.
//
// ******************************************************************************
package conformx.ensemble;

import java.util.Iterator;
import java.util.NoSuchElementException;

/**
 * A source of coordinates for a fixed set of atoms, such as a parsed multi-model structure or a
 * trajectory. Ensembles copy the coordinates of a provider once, when they are constructed.
 *
 * @author Michael J. Schnieders
 * @since 1.0
 */
public interface CoordinateProvider {

  /**
   * The number of atoms.
   *
   * @return the number of atoms.
   */
  int numAtoms();

  /**
   * The active coordinates [numAtoms][3].
   *
   * @return the active coordinates.
   */
  double[][] getCoordinates();

  /**
   * The number of coordinate sets.
   *
   * @return the number of coordinate sets.
   */
  int numCoordsets();

  /**
   * All coordinate sets [numCoordsets][numAtoms][3].
   *
   * @return all coordinate sets.
   */
  double[][][] getCoordsets();

  /**
   * One coordinate set [numAtoms][3].
   *
   * @param index the coordinate set index.
   * @return the coordinate set.
   */
  double[][] getCoordsets(int index);

  /**
   * Iterate over the coordinate sets in index order.
   *
   * @return an Iterable over coordinate sets.
   */
  default Iterable<double[][]> iterCoordsets() {
    return () -> new Iterator<>() {
      private int next = 0;

      @Override
      public boolean hasNext() {
        return next < numCoordsets();
      }

      @Override
      public double[][] next() {
        if (!hasNext()) {
          throw new NoSuchElementException();
        }
        return getCoordsets(next++);
      }
    };
  }
}
