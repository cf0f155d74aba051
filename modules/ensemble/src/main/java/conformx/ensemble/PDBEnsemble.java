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

import conformx.utilities.EnsembleProperties;
import java.util.ArrayList;
import java.util.Arrays;
import java.util.List;
import java.util.logging.Logger;
import org.apache.commons.configuration2.CompositeConfiguration;

/**
 * An ensemble of experimentally determined structures, where each conformation has its own per
 * atom weights. A weight of zero marks an atom that is missing from a conformation (for example,
 * an unresolved loop); coordinates of such atoms are carried along but are not meaningful.
 *
 * @author Michael J. Schnieders
 * @since 1.0
 */
public class PDBEnsemble extends AbstractEnsemble {

  private static final Logger logger = Logger.getLogger(PDBEnsemble.class.getName());

  /** One weight row [numAtoms] per coordinate set. */
  private final List<double[]> weights = new ArrayList<>();

  /** Create an empty ensemble with the default title. */
  public PDBEnsemble() {
    this(DEFAULT_TITLE);
  }

  /**
   * Create an empty ensemble.
   *
   * @param title the title of the ensemble.
   */
  public PDBEnsemble(String title) {
    this(title, EnsembleProperties.loadProperties(null));
  }

  /**
   * Create an empty ensemble.
   *
   * @param title      the title of the ensemble.
   * @param properties properties that control superposition.
   */
  public PDBEnsemble(String title, CompositeConfiguration properties) {
    super(title, properties);
  }

  /**
   * Create an ensemble from a provider; every atom of every coordinate set gets weight one.
   *
   * @param provider the source of coordinates.
   */
  public PDBEnsemble(CoordinateProvider provider) {
    this(provider, EnsembleProperties.loadProperties(null));
  }

  /**
   * Create an ensemble from a provider; every atom of every coordinate set gets weight one.
   *
   * @param provider   the source of coordinates.
   * @param properties properties that control superposition.
   */
  public PDBEnsemble(CoordinateProvider provider, CompositeConfiguration properties) {
    super(provider.toString(), properties);
    ingest(provider);
  }

  /**
   * Append a coordinate set with its own weights.
   *
   * @param coordinates [numAtoms][3] coordinates.
   * @param weights     [numAtoms] weights, or null for weights of one.
   * @throws ShapeMismatchException if the number of atoms disagrees.
   */
  public void addCoordset(double[][] coordinates, double[] weights) {
    checkCoordinates(coordinates);
    if (weights != null) {
      checkWeights(weights, coordinates.length);
    }
    appendCoordset(copyCoordinates(coordinates), weights);
  }

  /**
   * Append a batch of coordinate sets with their weights. Either all sets are added or none.
   *
   * @param coordinates [k][numAtoms][3] coordinates.
   * @param weights     [k][numAtoms] weights, or null for weights of one.
   * @throws ShapeMismatchException if the number of atoms or weight rows disagrees.
   */
  public void addCoordsets(double[][][] coordinates, double[][] weights) {
    if (weights == null) {
      addCoordsets(coordinates);
      return;
    }
    if (coordinates == null) {
      throw new IllegalArgumentException(" Coordinate sets must not be null.");
    }
    if (weights.length != coordinates.length) {
      throw new ShapeMismatchException(
          format(" Found %d weight rows for %d coordinate sets.", weights.length,
              coordinates.length), coordinates.length, weights.length);
    }
    int n = numAtoms;
    for (int i = 0; i < coordinates.length; i++) {
      checkCoordinates(coordinates[i]);
      if (n == 0) {
        n = coordinates[i].length;
      } else if (coordinates[i].length != n) {
        throw new ShapeMismatchException(
            format(" Coordinate sets with %d and %d atoms cannot be added together.",
                n, coordinates[i].length), n, coordinates[i].length);
      }
      if (weights[i] != null) {
        checkWeights(weights[i], n);
      }
    }
    for (int i = 0; i < coordinates.length; i++) {
      appendCoordset(copyCoordinates(coordinates[i]), weights[i]);
    }
  }

  /**
   * {@inheritDoc}
   * <p>
   * The weights of the new conformation are copied, or set to one when null.
   */
  @Override
  protected void appendCoordset(double[][] xyz, double[] weights) {
    double[] w;
    if (weights == null) {
      w = new double[xyz.length];
      Arrays.fill(w, 1.0);
    } else {
      w = weights.clone();
    }
    super.appendCoordset(xyz, w);
    this.weights.add(w);
  }

  /**
   * The weights of every conformation.
   *
   * @return a copy [numCoordsets][numAtoms], or null if there are no coordinate sets.
   */
  public double[][] getWeights() {
    if (weights.isEmpty()) {
      return null;
    }
    double[][] w = new double[weights.size()][];
    for (int i = 0; i < w.length; i++) {
      w[i] = weights.get(i).clone();
    }
    return w;
  }

  /**
   * Replace the weights of one conformation.
   *
   * @param index   coordinate set index.
   * @param weights [numAtoms] weights.
   */
  public void setWeights(int index, double[] weights) {
    int i = checkIndex(index);
    checkWeights(weights, numAtoms);
    this.weights.set(i, weights.clone());
  }

  /** {@inheritDoc} */
  @Override
  public double[] getConformationWeights(int index) {
    return weights.get(checkIndex(index)).clone();
  }

  /** {@inheritDoc} */
  @Override
  protected double[] fitWeights(int index) {
    return weights.get(index);
  }

  /** {@inheritDoc} */
  @Override
  protected void deleteWeights(boolean[] removed) {
    List<double[]> kept = new ArrayList<>(weights.size());
    for (int i = 0; i < removed.length; i++) {
      if (!removed[i]) {
        kept.add(weights.get(i));
      }
    }
    weights.clear();
    weights.addAll(kept);
  }

  /** {@inheritDoc} */
  @Override
  public PDBConformation getConformation(int index) {
    return new PDBConformation(this, checkIndex(index));
  }

  /** {@inheritDoc} */
  @Override
  public PDBEnsemble select(int... indices) {
    PDBEnsemble ensemble = new PDBEnsemble(getTitle(), properties);
    copyReferenceTo(ensemble);
    for (int index : indices) {
      int i = checkIndex(index);
      ensemble.coordsets.add(copyCoordinates(coordsets.get(i)));
      ensemble.weights.add(weights.get(i).clone());
    }
    return ensemble;
  }

  /** {@inheritDoc} */
  @Override
  public PDBEnsemble selectRange(int start, int end) {
    return (PDBEnsemble) super.selectRange(start, end);
  }

  /** {@inheritDoc} */
  @Override
  public PDBEnsemble copy() {
    return (PDBEnsemble) super.copy();
  }

  /**
   * Concatenate two ensembles. Weight rows are stacked in the same order as the coordinate sets;
   * the conformations of a plain {@link Ensemble} carry its shared weights, or weights of one.
   *
   * @param other the ensemble to append.
   * @return a new PDBEnsemble.
   * @throws DimensionMismatchException if the number of atoms disagrees.
   */
  @Override
  public PDBEnsemble concatenate(ConformationEnsemble other) {
    if (!(other instanceof AbstractEnsemble)) {
      throw new EnsembleTypeException(format(" Cannot concatenate %s with %s.",
          getClass().getSimpleName(), other));
    }
    return concatenate(this, (AbstractEnsemble) other);
  }

  /**
   * Concatenate two ensembles into a new PDBEnsemble. The title and reference coordinates come
   * from the left ensemble.
   *
   * @param left  the first ensemble.
   * @param right the ensemble to append.
   * @return a new PDBEnsemble.
   */
  static PDBEnsemble concatenate(AbstractEnsemble left, AbstractEnsemble right) {
    left.checkDimensions(right);
    PDBEnsemble ensemble = new PDBEnsemble(left.getTitle(), left.properties);
    left.copyReferenceTo(ensemble);
    if (ensemble.reference == null && right.reference != null) {
      ensemble.reference = copyCoordinates(right.reference);
    }
    ensemble.numAtoms = left.numAtoms > 0 ? left.numAtoms : right.numAtoms;
    for (AbstractEnsemble source : new AbstractEnsemble[]{left, right}) {
      for (int i = 0; i < source.coordsets.size(); i++) {
        double[][] xyz = source.coordsets.get(i);
        double[] w = source.fitWeights(i);
        if (w == null) {
          w = new double[xyz.length];
          Arrays.fill(w, 1.0);
        } else {
          w = w.clone();
        }
        ensemble.coordsets.add(copyCoordinates(xyz));
        ensemble.weights.add(w);
      }
    }
    logger.fine(format(" Concatenated %d and %d conformations into %s.",
        left.numCoordsets(), right.numCoordsets(), ensemble.getTitle()));
    return ensemble;
  }
}
