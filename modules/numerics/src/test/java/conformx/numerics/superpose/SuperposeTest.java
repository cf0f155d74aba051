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

import static conformx.numerics.math.MatrixMath.mat3Rotation;
import static conformx.numerics.math.MatrixMath.mat3Vec3;
import static org.apache.commons.math3.util.FastMath.sqrt;

import java.util.Arrays;
import java.util.Collection;

import conformx.utilities.ConformXTest;
import org.junit.Assert;
import org.junit.Test;
import org.junit.runner.RunWith;
import org.junit.runners.Parameterized;
import org.junit.runners.Parameterized.Parameters;

/**
 * Superposition of rigidly moved copies of a small, non-planar structure.
 */
@RunWith(Parameterized.class)
public class SuperposeTest extends ConformXTest {

  private static final double tolerance = 1.0e-8;

  static final double[][] REFERENCE = {
      {0.000, 0.000, 0.000},
      {1.526, 0.000, 0.000},
      {2.064, 1.421, 0.000},
      {3.590, 1.437, 0.120},
      {4.120, 2.760, -0.410},
      {5.610, 2.790, -0.270},
      {6.140, 4.170, 0.300},
      {2.310, -0.980, 1.150}};

  private final String info;
  private final double[] axis;
  private final double angle;
  private final double[] translation;

  public SuperposeTest(String info, double[] axis, double angle, double[] translation) {
    this.info = info;
    this.axis = axis;
    this.angle = angle;
    this.translation = translation;
  }

  @Parameters
  public static Collection<Object[]> data() {
    double s = 1.0 / sqrt(3.0);
    return Arrays.asList(
        new Object[][]{
            {"Identity", new double[]{0.0, 0.0, 1.0}, 0.0, new double[]{0.0, 0.0, 0.0}},
            {"Translation only", new double[]{0.0, 0.0, 1.0}, 0.0, new double[]{3.0, -4.0, 12.0}},
            {"90 degrees about X", new double[]{1.0, 0.0, 0.0}, Math.PI / 2.0,
                new double[]{1.0, 2.0, 3.0}},
            {"180 degrees about Y", new double[]{0.0, 1.0, 0.0}, Math.PI,
                new double[]{-5.0, 0.0, 0.5}},
            {"30 degrees about Z", new double[]{0.0, 0.0, 1.0}, Math.PI / 6.0,
                new double[]{0.0, 0.0, 0.0}},
            {"120 degrees about the diagonal", new double[]{s, s, s}, 2.0 * Math.PI / 3.0,
                new double[]{10.0, 10.0, -10.0}}
        });
  }

  static double[][] move(double[][] xyz, double[][] rotation, double[] translation) {
    double[][] moved = new double[xyz.length][3];
    for (int i = 0; i < xyz.length; i++) {
      mat3Vec3(rotation, xyz[i], moved[i]);
      for (int k = 0; k < 3; k++) {
        moved[i][k] += translation[k];
      }
    }
    return moved;
  }

  @Test
  public void testSuperposeRecoversReference() {
    double[][] moving = move(REFERENCE, mat3Rotation(axis, angle), translation);
    double rmsd = Superpose.superpose(moving, REFERENCE, null);
    Assert.assertEquals(info, 0.0, rmsd, tolerance);
    for (int i = 0; i < REFERENCE.length; i++) {
      Assert.assertArrayEquals(info, REFERENCE[i], moving[i], 1.0e-6);
    }
  }

  @Test
  public void testWeightedSuperposeIgnoresZeroWeightAtom() {
    double[][] moving = move(REFERENCE, mat3Rotation(axis, angle), translation);
    // Displace the last atom; it carries no weight so the fit stays exact.
    double[][] reference = new double[REFERENCE.length][];
    for (int i = 0; i < REFERENCE.length; i++) {
      reference[i] = REFERENCE[i].clone();
    }
    reference[7][2] += 2.0;
    double[] weights = new double[REFERENCE.length];
    Arrays.fill(weights, 1.0);
    weights[7] = 0.0;

    double rmsd = Superpose.superpose(moving, reference, weights);
    Assert.assertEquals(info, 0.0, rmsd, tolerance);
    // The zero weight atom was moved with the rest of the structure.
    Assert.assertArrayEquals(info, REFERENCE[7], moving[7], 1.0e-6);
    Assert.assertEquals(info, 2.0 / sqrt(8.0), Superpose.rmsd(moving, reference, null), 1.0e-6);
  }

  @Test
  public void testRmsdOfTranslation() {
    double[][] identity = mat3Rotation(new double[]{0.0, 0.0, 1.0}, 0.0);
    double[][] moved = move(REFERENCE, identity, translation);
    double expected = sqrt(translation[0] * translation[0] + translation[1] * translation[1]
        + translation[2] * translation[2]);
    Assert.assertEquals(info, expected, Superpose.rmsd(moved, REFERENCE, null), tolerance);
  }
}
