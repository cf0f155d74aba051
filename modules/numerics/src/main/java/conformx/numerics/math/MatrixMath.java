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
package conformx.numerics.math;

import static org.apache.commons.math3.util.FastMath.cos;
import static org.apache.commons.math3.util.FastMath.sin;

/**
 * The MatrixMath class is a small 3x3 matrix library used by the superposition code.
 * <p>
 * All methods are thread-safe and static.
 *
 * @author Michael J. Schnieders
 * @since 1.0
 */
public final class MatrixMath {

  private MatrixMath() {
    // Prevent instantiation.
  }

  /**
   * Calculate the determinant of a 3x3 matrix.
   *
   * @param m input matrix.
   * @return The determinant.
   */
  public static double mat3Determinant(double[][] m) {
    return m[0][0] * m[1][1] * m[2][2] - m[0][0] * m[1][2] * m[2][1]
        + m[0][1] * m[1][2] * m[2][0] - m[0][1] * m[1][0] * m[2][2]
        + m[0][2] * m[1][0] * m[2][1] - m[0][2] * m[1][1] * m[2][0];
  }

  /**
   * Multiply a 3x3 matrix m and a 3x3 matrix n. The output is returned in a newly allocated
   * 3x3 matrix.
   *
   * @param m an input 3x3 matrix.
   * @param n an input 3x3 matrix
   * @return Returns the 3x3 matrix result.
   */
  public static double[][] mat3Mat3Multiply(double[][] m, double[][] n) {
    double[][] result = new double[3][3];
    for (int i = 0; i < 3; i++) {
      for (int j = 0; j < 3; j++) {
        result[i][j] = m[i][0] * n[0][j] + m[i][1] * n[1][j] + m[i][2] * n[2][j];
      }
    }
    return result;
  }

  /**
   * Transpose a 3x3 matrix into newly allocated space.
   *
   * @param m an input 3x3 matrix.
   * @return the transpose of m.
   */
  public static double[][] mat3Transpose(double[][] m) {
    return new double[][]{
        {m[0][0], m[1][0], m[2][0]},
        {m[0][1], m[1][1], m[2][1]},
        {m[0][2], m[1][2], m[2][2]}};
  }

  /**
   * Multiply a 3x3 matrix by a column vector. The vector v may also be used for the output.
   *
   * @param m      an input 3x3 matrix.
   * @param v      an input vector of length 3.
   * @param output the vector m.v is stored here.
   * @return Returns the output vector.
   */
  public static double[] mat3Vec3(double[][] m, double[] v, double[] output) {
    double x = m[0][0] * v[0] + m[0][1] * v[1] + m[0][2] * v[2];
    double y = m[1][0] * v[0] + m[1][1] * v[1] + m[1][2] * v[2];
    double z = m[2][0] * v[0] + m[2][1] * v[1] + m[2][2] * v[2];
    output[0] = x;
    output[1] = y;
    output[2] = z;
    return output;
  }

  /**
   * Returns a 3x3 rotation matrix about an arbitrary unit axis (Rodrigues' formula).
   *
   * @param axis  a unit vector.
   * @param angle the rotation angle in radians.
   * @return the rotation matrix.
   */
  public static double[][] mat3Rotation(double[] axis, double angle) {
    double c = cos(angle);
    double s = sin(angle);
    double t = 1.0 - c;
    double x = axis[0];
    double y = axis[1];
    double z = axis[2];
    return new double[][]{
        {t * x * x + c, t * x * y - s * z, t * x * z + s * y},
        {t * x * y + s * z, t * y * y + c, t * y * z - s * x},
        {t * x * z - s * y, t * y * z + s * x, t * z * z + c}};
  }
}
