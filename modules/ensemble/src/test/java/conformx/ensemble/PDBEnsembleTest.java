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
import static conformx.ensemble.EnsembleTestData.NUM_ATOMS;
import static conformx.ensemble.EnsembleTestData.NUM_MODELS;
import static conformx.ensemble.EnsembleTestData.REFERENCE;
import static conformx.ensemble.EnsembleTestData.TOLERANCE;
import static conformx.ensemble.EnsembleTestData.WEIGHTS;
import static conformx.ensemble.EnsembleTestData.assertCoordinatesEqual;
import static conformx.ensemble.EnsembleTestData.assertCoordsetsEqual;
import static conformx.ensemble.EnsembleTestData.assertWeightedCoordsetsEqual;
import static conformx.ensemble.EnsembleTestData.maskedModels;
import static conformx.ensemble.EnsembleTestData.pdbEnsemble;
import static conformx.ensemble.EnsembleTestData.properties;
import static conformx.ensemble.EnsembleTestData.select;
import static org.junit.Assert.assertArrayEquals;
import static org.junit.Assert.assertEquals;
import static org.junit.Assert.assertNull;

import conformx.utilities.ConformXTest;
import org.junit.Before;
import org.junit.Test;

/**
 * Coordinate set life cycle of ensembles with per conformation weights.
 */
public class PDBEnsembleTest extends ConformXTest {

  private PDBEnsemble ensemble;

  @Before
  public void setUp() {
    ensemble = pdbEnsemble(properties(false));
  }

  @Test
  public void testGetCoordinates() {
    assertCoordinatesEqual("failed to set reference coordinates for PDBEnsemble", REFERENCE,
        ensemble.getCoordinates(), 0.0);
  }

  @Test
  public void testGetCoordsets() {
    assertWeightedCoordsetsEqual("failed to add coordinate sets for PDBEnsemble", MODELS,
        ensemble.getCoordsets(), WEIGHTS);
    // Coordinates of missing atoms are kept as given.
    assertCoordsetsEqual("stored coordinates changed", maskedModels(), ensemble.getCoordsets(),
        0.0);
  }

  @Test
  public void testGetWeights() {
    double[][] weights = ensemble.getWeights();
    assertEquals("failed to get correct weights shape", NUM_MODELS, weights.length);
    for (int i = 0; i < NUM_MODELS; i++) {
      assertEquals("failed to get correct weights shape", NUM_ATOMS, weights[i].length);
      assertArrayEquals("failed to get correct weights", WEIGHTS[i], weights[i], 0.0);
    }
  }

  @Test
  public void testGetWeightsReturnsCopy() {
    double[][] weights = ensemble.getWeights();
    weights[0][0] = 5.0;
    assertEquals(1.0, ensemble.getWeights()[0][0], 0.0);
  }

  @Test
  public void testWeightsFromProvider() {
    PDBEnsemble fromProvider = new PDBEnsemble(EnsembleTestData.provider(), properties(false));
    assertEquals(NUM_MODELS, fromProvider.numCoordsets());
    for (double[] w : fromProvider.getWeights()) {
      for (double wi : w) {
        assertEquals(1.0, wi, 0.0);
      }
    }
  }

  @Test
  public void testSetWeights() {
    PDBEnsemble copy = ensemble.copy();
    copy.setWeights(0, WEIGHTS[2]);
    assertArrayEquals(WEIGHTS[2], copy.getWeights()[0], 0.0);
    assertArrayEquals(WEIGHTS[0], ensemble.getWeights()[0], 0.0);
  }

  @Test
  public void testAddCoordsetsWithWeights() {
    PDBEnsemble built = new PDBEnsemble("batch", properties(false));
    built.setCoordinates(REFERENCE);
    built.addCoordsets(maskedModels(), WEIGHTS);
    assertCoordsetsEqual("failed to add coordinate sets", maskedModels(), built.getCoordsets(),
        0.0);
    assertArrayEquals(WEIGHTS[1], built.getWeights()[1], 0.0);
  }

  @Test
  public void testSlicingCopy() {
    PDBEnsemble slice = ensemble.copy();
    assertCoordinatesEqual("slicing copy failed to set reference coordinates for PDBEnsemble",
        ensemble.getCoordinates(), slice.getCoordinates(), 0.0);
    assertCoordsetsEqual("slicing copy failed to add coordinate sets for PDBEnsemble",
        ensemble.getCoordsets(), slice.getCoordsets(), 0.0);
  }

  @Test
  public void testSlicing() {
    PDBEnsemble slice = ensemble.selectRange(0, 2);
    assertCoordinatesEqual("slicing failed to set reference coordinates for PDBEnsemble",
        ensemble.getCoordinates(), slice.getCoordinates(), 0.0);
    assertCoordsetsEqual("slicing failed to add coordinate sets for PDBEnsemble",
        ensemble.getCoordsets(0, 1), slice.getCoordsets(), 0.0);
  }

  @Test
  public void testSlicingList() {
    PDBEnsemble slice = ensemble.select(0, 2);
    assertCoordsetsEqual("slicing failed to add coordinate sets for PDBEnsemble",
        ensemble.getCoordsets(0, 2), slice.getCoordsets(), 0.0);
  }

  @Test
  public void testSlicingWeights() {
    PDBEnsemble slice = ensemble.selectRange(0, 2);
    double[][] weights = slice.getWeights();
    assertEquals(2, weights.length);
    assertArrayEquals("slicing failed to set weights for PDBEnsemble", WEIGHTS[0], weights[0],
        0.0);
    assertArrayEquals("slicing failed to set weights for PDBEnsemble", WEIGHTS[1], weights[1],
        0.0);
  }

  @Test
  public void testIterCoordsets() {
    double[][][] masked = maskedModels();
    int i = 0;
    for (double[][] xyz : ensemble.iterCoordsets()) {
      assertCoordinatesEqual("failed yield correct coordinates for PDBEnsemble", masked[i], xyz,
          0.0);
      i++;
    }
    assertEquals(NUM_MODELS, i);
  }

  @Test
  public void testDelCoordsetMiddle() {
    PDBEnsemble copy = ensemble.copy();
    copy.delCoordset(1);
    assertCoordsetsEqual("failed to delete middle coordinate set for PDBEnsemble",
        select(maskedModels(), 0, 2), copy.getCoordsets(), 0.0);
    double[][] weights = copy.getWeights();
    assertEquals(2, weights.length);
    assertArrayEquals("failed to delete middle coordinate set weights", WEIGHTS[0], weights[0],
        0.0);
    assertArrayEquals("failed to delete middle coordinate set weights", WEIGHTS[2], weights[1],
        0.0);
  }

  @Test
  public void testDelCoordsetAll() {
    PDBEnsemble copy = ensemble.copy();
    copy.delCoordsets(0, copy.numCoordsets());
    assertNull("failed to delete all coordinate sets for PDBEnsemble", copy.getCoordsets());
    assertNull("failed to delete all coordinate set weights for PDBEnsemble", copy.getWeights());
    assertCoordinatesEqual("failed when deleting all coordinate sets for PDBEnsemble", REFERENCE,
        copy.getCoordinates(), 0.0);
  }

  @Test
  public void testConcatenation() {
    PDBEnsemble concatenated = ensemble.concatenate(ensemble);
    assertEquals(2 * NUM_MODELS, concatenated.numCoordsets());
    assertCoordsetsEqual("concatenation failed", maskedModels(),
        concatenated.getCoordsets(0, 1, 2), 0.0);
    assertCoordsetsEqual("concatenation failed", maskedModels(),
        concatenated.getCoordsets(3, 4, 5), 0.0);
    assertCoordinatesEqual("concatenation failed", REFERENCE, concatenated.getCoordinates(), 0.0);
    double[][] weights = concatenated.getWeights();
    for (int i = 0; i < NUM_MODELS; i++) {
      assertArrayEquals("concatenation failed", WEIGHTS[i], weights[i], 0.0);
      assertArrayEquals("concatenation failed", WEIGHTS[i], weights[NUM_MODELS + i], 0.0);
    }
  }

  @Test
  public void testConcatenationWithEnsemble() {
    Ensemble plain = new Ensemble(EnsembleTestData.provider(), properties(false));
    PDBEnsemble concatenated = ensemble.concatenate(plain);
    assertEquals(2 * NUM_MODELS, concatenated.numCoordsets());
    assertCoordsetsEqual("concatenation failed", MODELS, concatenated.getCoordsets(3, 4, 5), 0.0);
    double[][] weights = concatenated.getWeights();
    for (int i = NUM_MODELS; i < 2 * NUM_MODELS; i++) {
      for (double w : weights[i]) {
        assertEquals("unweighted conformations take weights of one", 1.0, w, 0.0);
      }
    }
  }

  @Test
  public void testConcatenationWithEmptyEnsemble() {
    PDBEnsemble empty = new PDBEnsemble("empty", properties(false));
    PDBEnsemble concatenated = empty.concatenate(ensemble);
    assertEquals(NUM_ATOMS, concatenated.numAtoms());
    assertEquals(NUM_MODELS, concatenated.numCoordsets());
    assertCoordinatesEqual("reference taken from the non-empty ensemble", REFERENCE,
        concatenated.getCoordinates(), 0.0);
  }

  @Test
  public void testRMSDsBeforeSuperposition() {
    double[] rmsd = ensemble.getRMSDs();
    assertEquals(0.0, rmsd[0], TOLERANCE);
    assertEquals(5.0, rmsd[1], TOLERANCE);
    assertEquals(EnsembleTestData.rmsd(MODELS[2], REFERENCE, WEIGHTS[2]), rmsd[2], TOLERANCE);
  }
}
