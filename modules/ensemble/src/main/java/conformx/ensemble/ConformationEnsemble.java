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

/**
 * Operations shared by every ensemble of conformations, whether the atoms are weighted uniformly
 * ({@link Ensemble}) or per conformation ({@link PDBEnsemble}).
 * <p>
 * Coordinate sets are [numAtoms][3] arrays. Arrays passed in are copied and arrays returned are
 * copies.
 *
 * @author Michael J. Schnieders
 * @since 1.0
 */
public interface ConformationEnsemble extends Iterable<Conformation> {

  String getTitle();

  void setTitle(String title);

  /**
   * The number of atoms, or 0 if no coordinates have been seen yet.
   *
   * @return the number of atoms.
   */
  int numAtoms();

  int numCoordsets();

  /**
   * Reference coordinates that conformations are superposed onto.
   *
   * @return a copy of the reference coordinates, or null if none are set.
   */
  double[][] getCoordinates();

  void setCoordinates(double[][] coordinates);

  /**
   * Append a coordinate set.
   *
   * @param coordinates [numAtoms][3] coordinates.
   * @throws ShapeMismatchException if the number of atoms disagrees.
   */
  void addCoordset(double[][] coordinates);

  /**
   * Append a batch of coordinate sets. Either all sets are added or none.
   *
   * @param coordinates [k][numAtoms][3] coordinates.
   * @throws ShapeMismatchException if the number of atoms of any set disagrees.
   */
  void addCoordsets(double[][][] coordinates);

  /**
   * All coordinate sets.
   *
   * @return a copy [numCoordsets][numAtoms][3], or null if there are no coordinate sets.
   */
  double[][][] getCoordsets();

  /**
   * The requested coordinate sets.
   *
   * @param indices coordinate set indices; negative values count from the end.
   * @return a copy [k][numAtoms][3], or null if there are no coordinate sets.
   */
  double[][][] getCoordsets(int... indices);

  double[][] getCoordset(int index);

  /**
   * Delete coordinate sets; the remaining sets are re-indexed from 0.
   *
   * @param indices coordinate set indices; negative values count from the end.
   */
  void delCoordset(int... indices);

  /**
   * Delete the coordinate sets in [start, end).
   *
   * @param start first index to delete.
   * @param end   one past the last index to delete.
   */
  void delCoordsets(int start, int end);

  Iterable<double[][]> iterCoordsets();

  Conformation getConformation(int index);

  /**
   * A new ensemble holding copies of the selected coordinate sets, the reference coordinates and
   * the weights.
   *
   * @param indices coordinate set indices.
   * @return a new ensemble.
   */
  ConformationEnsemble select(int... indices);

  ConformationEnsemble selectRange(int start, int end);

  /**
   * A new ensemble holding the coordinate sets of this ensemble followed by those of other.
   *
   * @param other the ensemble to append.
   * @return a new ensemble.
   * @throws DimensionMismatchException if the number of atoms disagrees.
   */
  ConformationEnsemble concatenate(ConformationEnsemble other);

  /**
   * Superpose every coordinate set onto the reference coordinates, in place.
   */
  void superpose();

  /**
   * Weighted RMSD of every coordinate set from the reference coordinates.
   *
   * @return one RMSD per coordinate set, in index order.
   */
  double[] getRMSDs();
}
