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
package conformx.numerics.superpose;

import static conformx.numerics.math.MatrixMath.mat3Determinant;
import static conformx.numerics.math.MatrixMath.mat3Mat3Multiply;
import static conformx.numerics.math.MatrixMath.mat3Transpose;
import static conformx.numerics.math.MatrixMath.mat3Vec3;
import static java.lang.String.format;
import static org.apache.commons.math3.util.FastMath.sqrt;

import java.util.logging.Level;
import java.util.logging.Logger;

import org.apache.commons.math3.linear.Array2DRowRealMatrix;
import org.apache.commons.math3.linear.RealMatrix;
import org.apache.commons.math3.linear.SingularValueDecomposition;

/**
 * Weighted least-squares rigid-body superposition and weighted RMSD.
 * <p>
 * Coordinates are stored as [nAtoms][3] arrays. A null weight array means every atom has weight
 * one. Atoms with zero weight do not contribute to the fit, but the fitted rotation and translation
 * are applied to all atoms.
 * <p>
 * All methods are static and thread-safe as long as different threads do not share the moving
 * coordinates.
 *
 * @author Michael J. Schnieders
 * @since 1.0
 */
public final class Superpose {

  private static final Logger logger = Logger.getLogger(Superpose.class.getName());

  private Superpose() {
    // Prevent instantiation.
  }

  /**
   * Check a weight array against the number of atoms and return the total weight.
   *
   * @param weights per atom weights (null means all ones).
   * @param nAtoms  the number of atoms.
   * @return the sum of the weights.
   * @throws IllegalArgumentException if the length disagrees or a weight is negative or NaN.
   * @throws DegenerateWeightsException if the weights sum to zero.
   */
  public static double totalWeight(double[] weights, int nAtoms) {
    if (weights == null) {
      if (nAtoms == 0) {
        throw new DegenerateWeightsException(" No atoms are available for a weighted fit.", 0.0);
      }
      return nAtoms;
    }
    if (weights.length != nAtoms) {
      throw new IllegalArgumentException(
          format(" Found %d weights for %d atoms.", weights.length, nAtoms));
    }
    double total = 0.0;
    for (int i = 0; i < nAtoms; i++) {
      double w = weights[i];
      if (!(w >= 0.0)) {
        throw new IllegalArgumentException(format(" Weight %d (%s) must be non-negative.", i, w));
      }
      total += w;
    }
    if (total <= 0.0) {
      throw new DegenerateWeightsException(" The weights of all atoms are zero.", total);
    }
    return total;
  }

  /**
   * Compute the weighted centroid of a set of coordinates.
   *
   * @param xyz     coordinates [nAtoms][3].
   * @param weights per atom weights (null means all ones).
   * @return the weighted centroid.
   */
  public static double[] centroid(double[][] xyz, double[] weights) {
    int nAtoms = xyz.length;
    double total = totalWeight(weights, nAtoms);
    double[] c = new double[3];
    for (int i = 0; i < nAtoms; i++) {
      double w = weights == null ? 1.0 : weights[i];
      if (w == 0.0) {
        continue;
      }
      c[0] += w * xyz[i][0];
      c[1] += w * xyz[i][1];
      c[2] += w * xyz[i][2];
    }
    c[0] /= total;
    c[1] /= total;
    c[2] /= total;
    return c;
  }

  /**
   * Compute the rotation that best maps the centered moving coordinates onto the centered target
   * coordinates in the weighted least-squares sense. The result is always a proper rotation.
   *
   * @param moving         moving coordinates [nAtoms][3].
   * @param movingCentroid weighted centroid of the moving coordinates.
   * @param target         target coordinates [nAtoms][3].
   * @param targetCentroid weighted centroid of the target coordinates.
   * @param weights        per atom weights (null means all ones).
   * @return a 3x3 rotation matrix.
   */
  public static double[][] calculateRotation(double[][] moving, double[] movingCentroid,
      double[][] target, double[] targetCentroid, double[] weights) {
    // Weighted cross-covariance H = sum w x' y'^T.
    double[][] h = new double[3][3];
    for (int i = 0; i < moving.length; i++) {
      double w = weights == null ? 1.0 : weights[i];
      if (w == 0.0) {
        continue;
      }
      for (int a = 0; a < 3; a++) {
        double xa = w * (moving[i][a] - movingCentroid[a]);
        for (int b = 0; b < 3; b++) {
          h[a][b] += xa * (target[i][b] - targetCentroid[b]);
        }
      }
    }

    RealMatrix covariance = new Array2DRowRealMatrix(h, false);
    SingularValueDecomposition svd = new SingularValueDecomposition(covariance);
    double[][] u = svd.getU().getData();
    double[][] v = svd.getV().getData();
    double[][] ut = mat3Transpose(u);
    double[][] rotation = mat3Mat3Multiply(v, ut);

    // A negative determinant is a reflection; flip the vector of the smallest singular value.
    if (mat3Determinant(rotation) < 0.0) {
      for (int k = 0; k < 3; k++) {
        v[k][2] = -v[k][2];
      }
      rotation = mat3Mat3Multiply(v, ut);
    }
    return rotation;
  }

  /**
   * Superpose the moving coordinates onto the target coordinates in place.
   *
   * @param moving  moving coordinates [nAtoms][3]; overwritten with the superposed coordinates.
   * @param target  target coordinates [nAtoms][3]; not modified.
   * @param weights per atom weights (null means all ones).
   * @return the weighted RMSD after superposition.
   * @throws DegenerateWeightsException if the weights sum to zero.
   */
  public static double superpose(double[][] moving, double[][] target, double[] weights) {
    checkShapes(moving, target);
    double[] movingCentroid = centroid(moving, weights);
    double[] targetCentroid = centroid(target, weights);
    double[][] rotation = calculateRotation(moving, movingCentroid, target, targetCentroid,
        weights);
    applyTransform(moving, movingCentroid, rotation, targetCentroid);
    double rmsd = rmsd(moving, target, weights);
    if (logger.isLoggable(Level.FINEST)) {
      logger.finest(format(" Superposed %d atoms (RMSD %8.5f).", moving.length, rmsd));
    }
    return rmsd;
  }

  /**
   * Move coordinates by x'' = R (x - from) + to.
   *
   * @param xyz      coordinates [nAtoms][3]; overwritten.
   * @param from     the point moved to the origin before rotation.
   * @param rotation a 3x3 rotation matrix.
   * @param to       the point the origin is moved to after rotation.
   */
  public static void applyTransform(double[][] xyz, double[] from, double[][] rotation,
      double[] to) {
    double[] d = new double[3];
    for (double[] x : xyz) {
      d[0] = x[0] - from[0];
      d[1] = x[1] - from[1];
      d[2] = x[2] - from[2];
      mat3Vec3(rotation, d, d);
      x[0] = d[0] + to[0];
      x[1] = d[1] + to[1];
      x[2] = d[2] + to[2];
    }
  }

  /**
   * Compute the weighted RMSD between two sets of coordinates without superposing them.
   *
   * @param x1      first coordinates [nAtoms][3].
   * @param x2      second coordinates [nAtoms][3].
   * @param weights per atom weights (null means all ones).
   * @return sqrt(sum w |x1 - x2|^2 / sum w).
   * @throws DegenerateWeightsException if the weights sum to zero.
   */
  public static double rmsd(double[][] x1, double[][] x2, double[] weights) {
    checkShapes(x1, x2);
    double total = totalWeight(weights, x1.length);
    double msd = 0.0;
    for (int i = 0; i < x1.length; i++) {
      double w = weights == null ? 1.0 : weights[i];
      if (w == 0.0) {
        continue;
      }
      double dx = x1[i][0] - x2[i][0];
      double dy = x1[i][1] - x2[i][1];
      double dz = x1[i][2] - x2[i][2];
      msd += w * (dx * dx + dy * dy + dz * dz);
    }
    return sqrt(msd / total);
  }

  private static void checkShapes(double[][] x1, double[][] x2) {
    if (x1.length != x2.length) {
      throw new IllegalArgumentException(
          format(" Coordinate sets have %d and %d atoms.", x1.length, x2.length));
    }
  }
}
