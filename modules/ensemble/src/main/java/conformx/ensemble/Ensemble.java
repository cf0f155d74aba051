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
import java.util.logging.Logger;
import org.apache.commons.configuration2.CompositeConfiguration;

/**
 * An ensemble of conformations that share one set of per atom weights. Without weights every atom
 * counts equally in superposition and RMSD calculations.
 *
 * @author Michael J. Schnieders
 * @since 1.0
 */
public class Ensemble extends AbstractEnsemble {

  private static final Logger logger = Logger.getLogger(Ensemble.class.getName());

  /** Per atom weights [numAtoms], or null. */
  private double[] weights = null;

  /**
   * Create an empty ensemble.
   *
   * @param title the title of the ensemble.
   */
  public Ensemble(String title) {
    this(title, EnsembleProperties.loadProperties(null));
  }

  /**
   * Create an empty ensemble.
   *
   * @param title      the title of the ensemble.
   * @param properties properties that control superposition.
   */
  public Ensemble(String title, CompositeConfiguration properties) {
    super(title, properties);
  }

  /**
   * Create an ensemble from the reference coordinates and coordinate sets of a provider.
   *
   * @param provider the source of coordinates.
   */
  public Ensemble(CoordinateProvider provider) {
    this(provider, EnsembleProperties.loadProperties(null));
  }

  /**
   * Create an ensemble from the reference coordinates and coordinate sets of a provider.
   *
   * @param provider   the source of coordinates.
   * @param properties properties that control superposition.
   */
  public Ensemble(CoordinateProvider provider, CompositeConfiguration properties) {
    super(provider.toString(), properties);
    ingest(provider);
  }

  /**
   * The weights shared by all conformations.
   *
   * @return a copy of the weights [numAtoms], or null if the atoms are not weighted.
   */
  public double[] getWeights() {
    return weights == null ? null : weights.clone();
  }

  /**
   * Set the weights shared by all conformations.
   *
   * @param weights per atom weights [numAtoms], or null to remove the weights.
   * @throws ShapeMismatchException if the number of weights disagrees with the number of atoms.
   */
  public void setWeights(double[] weights) {
    if (weights == null) {
      this.weights = null;
      return;
    }
    if (numAtoms == 0) {
      checkWeights(weights, weights.length);
      if (weights.length == 0) {
        throw new ShapeMismatchException(" Weights must not be empty.", 1, 0);
      }
      numAtoms = weights.length;
    } else {
      checkWeights(weights, numAtoms);
    }
    this.weights = weights.clone();
    logger.fine(format(" Set weights of %d atoms for %s.", numAtoms, getTitle()));
  }

  /** {@inheritDoc} */
  @Override
  public double[] getConformationWeights(int index) {
    checkIndex(index);
    return getWeights();
  }

  /** {@inheritDoc} */
  @Override
  protected double[] fitWeights(int index) {
    return weights;
  }

  /** {@inheritDoc} */
  @Override
  public Conformation getConformation(int index) {
    return new Conformation(this, checkIndex(index));
  }

  /** {@inheritDoc} */
  @Override
  public Ensemble select(int... indices) {
    Ensemble ensemble = new Ensemble(getTitle(), properties);
    copyReferenceTo(ensemble);
    ensemble.weights = getWeights();
    for (int index : indices) {
      ensemble.coordsets.add(copyCoordinates(coordsets.get(checkIndex(index))));
    }
    return ensemble;
  }

  /** {@inheritDoc} */
  @Override
  public Ensemble selectRange(int start, int end) {
    return (Ensemble) super.selectRange(start, end);
  }

  /** {@inheritDoc} */
  @Override
  public Ensemble copy() {
    return (Ensemble) super.copy();
  }

  /**
   * Concatenate two ensembles. The weights of the result are those of this ensemble if it has
   * weights, otherwise those of the other ensemble (or none).
   *
   * @param other the ensemble to append.
   * @return a new Ensemble.
   * @throws DimensionMismatchException if the number of atoms disagrees.
   */
  public Ensemble concatenate(Ensemble other) {
    checkDimensions(other);
    Ensemble ensemble = new Ensemble(getTitle(), properties);
    copyReferenceTo(ensemble);
    if (ensemble.reference == null && other.reference != null) {
      ensemble.reference = copyCoordinates(other.reference);
    }
    ensemble.numAtoms = numAtoms > 0 ? numAtoms : other.numAtoms;
    if (weights != null) {
      ensemble.weights = weights.clone();
    } else if (other.weights != null) {
      ensemble.weights = other.weights.clone();
    }
    for (double[][] xyz : coordsets) {
      ensemble.coordsets.add(copyCoordinates(xyz));
    }
    for (double[][] xyz : other.coordsets) {
      ensemble.coordsets.add(copyCoordinates(xyz));
    }
    return ensemble;
  }

  /**
   * Concatenate two ensembles. Appending a {@link PDBEnsemble} gives a PDBEnsemble in which the
   * conformations of this ensemble carry its weights (or weights of one).
   *
   * @param other the ensemble to append.
   * @return a new Ensemble or PDBEnsemble.
   */
  @Override
  public AbstractEnsemble concatenate(ConformationEnsemble other) {
    if (other instanceof PDBEnsemble) {
      return PDBEnsemble.concatenate(this, (PDBEnsemble) other);
    } else if (other instanceof Ensemble) {
      return concatenate((Ensemble) other);
    }
    throw new EnsembleTypeException(
        format(" Cannot concatenate %s with %s.", getClass().getSimpleName(), other));
  }
}
