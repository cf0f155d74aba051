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

import static java.lang.String.format;

/**
 * A read-only view of one coordinate set of an ensemble. The view stores only the ensemble and an
 * index; every call reads the ensemble again.
 * <p>
 * Deleting or adding coordinate sets after a view is created may leave the view pointing at a
 * different conformation, or at none.
 *
 * @author Michael J. Schnieders
 * @since 1.0
 */
public class Conformation {

  /** The ensemble this conformation belongs to. */
  protected final AbstractEnsemble ensemble;
  /** Index of the coordinate set in the ensemble. */
  protected final int index;

  /**
   * Constructor for Conformation.
   *
   * @param ensemble the owning ensemble.
   * @param index    the coordinate set index.
   */
  public Conformation(AbstractEnsemble ensemble, int index) {
    this.ensemble = ensemble;
    this.index = index;
  }

  public AbstractEnsemble getEnsemble() {
    return ensemble;
  }

  /**
   * The index of this conformation in its ensemble.
   *
   * @return the coordinate set index.
   */
  public int getIndex() {
    return index;
  }

  public int numAtoms() {
    return ensemble.numAtoms();
  }

  /**
   * The coordinates of this conformation.
   *
   * @return a copy [numAtoms][3].
   */
  public double[][] getCoordinates() {
    return ensemble.getCoordset(index);
  }

  /**
   * The per atom weights that apply to this conformation.
   *
   * @return a copy [numAtoms], or null if the atoms are not weighted.
   */
  public double[] getWeights() {
    return ensemble.getConformationWeights(index);
  }

  /**
   * Weighted RMSD from the reference coordinates of the ensemble.
   *
   * @return the RMSD.
   */
  public double getRMSD() {
    return ensemble.getRMSD(index);
  }

  /**
   * Differences from the reference coordinates of the ensemble.
   *
   * @return [numAtoms][3] deviations.
   */
  public double[][] getDeviations() {
    return ensemble.getDeviations(index);
  }

  @Override
  public String toString() {
    return format("Conformation %d from %s", index, ensemble.getTitle());
  }
}
