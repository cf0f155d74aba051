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

import java.util.logging.Logger;

/**
 * Static utilities for ensembles of conformations.
 *
 * @author Michael J. Schnieders
 * @since 1.0
 */
public final class EnsembleUtils {

  private static final Logger logger = Logger.getLogger(EnsembleUtils.class.getName());

  private EnsembleUtils() {
    // Prevent instantiation.
  }

  /**
   * Sum the weights of every atom over all conformations. For ensembles of experimental structures
   * this counts the conformations in which each atom was resolved.
   *
   * @param ensemble a {@link PDBEnsemble}.
   * @return per atom sums [numAtoms], or null if the ensemble has no coordinate sets.
   * @throws EnsembleTypeException if the ensemble does not have per conformation weights.
   */
  public static double[] calcSumOfWeights(ConformationEnsemble ensemble) {
    if (!(ensemble instanceof PDBEnsemble)) {
      throw new EnsembleTypeException(format(" %s is not a PDBEnsemble.", ensemble));
    }
    double[][] weights = ((PDBEnsemble) ensemble).getWeights();
    if (weights == null) {
      logger.fine(format(" %s has no weights to sum.", ensemble.getTitle()));
      return null;
    }
    double[] sum = new double[ensemble.numAtoms()];
    for (double[] w : weights) {
      for (int a = 0; a < sum.length; a++) {
        sum[a] += w[a];
      }
    }
    return sum;
  }

  /**
   * Occupancy of every atom: the sum of its weights over all conformations, optionally divided by
   * the number of conformations.
   *
   * @param ensemble a {@link PDBEnsemble}.
   * @param normed   divide by the number of conformations.
   * @return per atom occupancies [numAtoms], or null if the ensemble has no coordinate sets.
   * @throws EnsembleTypeException if the ensemble does not have per conformation weights.
   */
  public static double[] calcOccupancies(ConformationEnsemble ensemble, boolean normed) {
    double[] occupancies = calcSumOfWeights(ensemble);
    if (occupancies != null && normed) {
      int n = ensemble.numCoordsets();
      for (int a = 0; a < occupancies.length; a++) {
        occupancies[a] /= n;
      }
    }
    return occupancies;
  }
}
