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

import static conformx.ensemble.EnsembleTestData.MODELS;
import static conformx.ensemble.EnsembleTestData.NUM_MODELS;
import static conformx.ensemble.EnsembleTestData.REFERENCE;
import static conformx.ensemble.EnsembleTestData.TOLERANCE;
import static conformx.ensemble.EnsembleTestData.WEIGHTS;
import static conformx.ensemble.EnsembleTestData.assertCoordinatesEqual;
import static conformx.ensemble.EnsembleTestData.pdbEnsemble;
import static conformx.ensemble.EnsembleTestData.properties;
import static conformx.ensemble.EnsembleTestData.provider;
import static conformx.ensemble.EnsembleTestData.radiusOfGyration;
import static conformx.ensemble.EnsembleTestData.rmsd;
import static org.junit.Assert.assertArrayEquals;
import static org.junit.Assert.assertEquals;

import conformx.utilities.ConformXTest;
import java.util.Arrays;
import java.util.Collection;
import org.apache.commons.configuration2.CompositeConfiguration;
import org.junit.Test;
import org.junit.runner.RunWith;
import org.junit.runners.Parameterized;
import org.junit.runners.Parameterized.Parameters;

/**
 * Superposition of ensembles onto their reference coordinates, run sequentially and in parallel.
 */
@RunWith(Parameterized.class)
public class EnsembleSuperposeTest extends ConformXTest {

  private final String info;
  private final boolean parallel;

  public EnsembleSuperposeTest(String info, boolean parallel) {
    this.info = info;
    this.parallel = parallel;
  }

  @Parameters
  public static Collection<Object[]> data() {
    return Arrays.asList(new Object[][]{
        {"Sequential superposition", false},
        {"Parallel superposition", true}});
  }

  @Test
  public void testRMSDsBeforeSuperposition() {
    Ensemble ensemble = new Ensemble(provider(), properties(parallel));
    double[] rmsd = ensemble.getRMSDs();
    assertEquals(info, NUM_MODELS, rmsd.length);
    assertEquals(info, 0.0, rmsd[0], TOLERANCE);
    assertEquals(info, 5.0, rmsd[1], TOLERANCE);
    assertEquals(info, rmsd(MODELS[2], REFERENCE, null), rmsd[2], TOLERANCE);
  }

  @Test
  public void testSuperpose() {
    Ensemble ensemble = new Ensemble(provider(), properties(parallel));
    ensemble.superpose();
    double[] rmsd = ensemble.getRMSDs();
    assertEquals(info, 0.0, rmsd[0], TOLERANCE);
    assertEquals(info, 0.0, rmsd[1], TOLERANCE);
    assertEquals(info, 0.1 * radiusOfGyration(null), rmsd[2], TOLERANCE);
    assertCoordinatesEqual(info, REFERENCE, ensemble.getCoordset(1), 1.0e-6);
    // The reference coordinates never move.
    assertCoordinatesEqual(info, REFERENCE, ensemble.getCoordinates(), 0.0);
  }

  @Test
  public void testSuperposeTwice() {
    Ensemble ensemble = new Ensemble(provider(), properties(parallel));
    ensemble.superpose();
    double[] first = ensemble.getRMSDs();
    ensemble.superpose();
    assertArrayEquals(info, first, ensemble.getRMSDs(), TOLERANCE);
  }

  @Test
  public void testSuperposeWithSharedWeights() {
    Ensemble ensemble = new Ensemble(provider(), properties(parallel));
    ensemble.setWeights(WEIGHTS[2]);
    ensemble.superpose();
    double[] rmsd = ensemble.getRMSDs();
    assertEquals(info, 0.0, rmsd[1], TOLERANCE);
    assertEquals(info, 0.1 * radiusOfGyration(WEIGHTS[2]), rmsd[2], TOLERANCE);
  }

  @Test
  public void testSuperposePDBEnsemble() {
    PDBEnsemble ensemble = pdbEnsemble(properties(parallel));
    ensemble.superpose();
    double[] rmsd = ensemble.getRMSDs();
    assertEquals(info, 0.0, rmsd[0], TOLERANCE);
    assertEquals(info, 0.0, rmsd[1], TOLERANCE);
    assertEquals(info, 0.1 * radiusOfGyration(WEIGHTS[2]), rmsd[2], TOLERANCE);
    // Weights do not change during superposition.
    assertArrayEquals(info, WEIGHTS[2], ensemble.getWeights()[2], 0.0);
  }

  @Test
  public void testSuperposeEmptyEnsemble() {
    Ensemble ensemble = new Ensemble("empty", properties(parallel));
    ensemble.superpose();
    assertEquals(info, 0, ensemble.getRMSDs().length);
  }

  @Test
  public void testIterpose() {
    CompositeConfiguration tight = properties(parallel);
    tight.addProperty("iterpose-rmsd", 1.0e-8);
    tight.addProperty("iterpose-max-iterations", 200);
    Ensemble ensemble = new Ensemble(provider(), tight);
    double[][] mean = ensemble.iterpose();
    assertEquals(info, REFERENCE.length, mean.length);
    assertCoordinatesEqual(info, REFERENCE, ensemble.getCoordinates(), 0.0);
    // Models 0 and 1 have the same shape, so they land on top of each other.
    assertEquals(info, 0.0, rmsd(ensemble.getCoordset(0), ensemble.getCoordset(1), null),
        1.0e-6);
    assertCoordinatesEqual(info, mean, ensemble.getMeanCoordinates(), 1.0e-9);
  }
}
