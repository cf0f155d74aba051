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

import static conformx.utilities.EnsembleProperties.DEFAULT_ITERPOSE_MAX_ITERATIONS;
import static conformx.utilities.EnsembleProperties.DEFAULT_ITERPOSE_RMSD;
import static conformx.utilities.EnsembleProperties.ENSEMBLE_PARALLEL;
import static conformx.utilities.EnsembleProperties.ITERPOSE_MAX_ITERATIONS;
import static conformx.utilities.EnsembleProperties.ITERPOSE_RMSD;
import static java.lang.String.format;
import static org.apache.commons.math3.util.FastMath.sqrt;

import conformx.numerics.superpose.Superpose;
import java.util.ArrayList;
import java.util.Iterator;
import java.util.List;
import java.util.NoSuchElementException;
import java.util.logging.Level;
import java.util.logging.Logger;
import java.util.stream.IntStream;
import org.apache.commons.configuration2.CompositeConfiguration;

/**
 * The AbstractEnsemble class holds reference coordinates and an ordered list of coordinate sets
 * for a fixed number of atoms. It implements the coordinate set life cycle and the superposition
 * and RMSD calculations; subclasses decide how atoms are weighted.
 * <p>
 * Instances are not thread safe. Structural changes (adding or deleting coordinate sets) while a
 * {@link Conformation} view or an iterator is in use leave the view pointing at whatever set now
 * occupies its index.
 *
 * @author Michael J. Schnieders
 * @since 1.0
 */
public abstract class AbstractEnsemble implements ConformationEnsemble {

  private static final Logger logger = Logger.getLogger(AbstractEnsemble.class.getName());

  /** Title used when none is given. */
  public static final String DEFAULT_TITLE = "Unknown";

  /** Properties that control superposition. */
  protected final CompositeConfiguration properties;
  /** The coordinate sets; each is [numAtoms][3]. */
  protected final List<double[][]> coordsets = new ArrayList<>();
  /** Reference coordinates [numAtoms][3], or null. */
  protected double[][] reference = null;
  /** Fixed once the first coordinates are seen. */
  protected int numAtoms = 0;

  private String title;
  private boolean parallel;

  /**
   * Constructor for AbstractEnsemble.
   *
   * @param title      the title of the ensemble.
   * @param properties properties that control superposition.
   */
  protected AbstractEnsemble(String title, CompositeConfiguration properties) {
    setTitle(title);
    this.properties = properties;
    this.parallel = properties.getBoolean(ENSEMBLE_PARALLEL, false);
  }

  /**
   * Copy the coordinates of a provider into this ensemble.
   *
   * @param provider the source of coordinates.
   */
  protected void ingest(CoordinateProvider provider) {
    int n = provider.numAtoms();
    if (n <= 0) {
      throw new ShapeMismatchException(
          format(" Coordinate provider %s has no atoms.", provider), 1, n);
    }
    numAtoms = n;
    double[][] coordinates = provider.getCoordinates();
    if (coordinates != null) {
      setCoordinates(coordinates);
    }
    List<double[][]> sets = new ArrayList<>();
    for (double[][] xyz : provider.iterCoordsets()) {
      sets.add(xyz);
    }
    addCoordsets(sets.toArray(new double[0][][]));
    logger.fine(format(" Copied %d coordinate sets of %d atoms from %s.",
        sets.size(), numAtoms, provider));
  }

  /** {@inheritDoc} */
  @Override
  public String getTitle() {
    return title;
  }

  /** {@inheritDoc} */
  @Override
  public void setTitle(String title) {
    if (title == null || title.isBlank()) {
      this.title = DEFAULT_TITLE;
    } else {
      this.title = title;
    }
  }

  /**
   * Whether conformations are processed in parallel by {@link #superpose()} and
   * {@link #getRMSDs()}.
   *
   * @return true for parallel processing.
   */
  public boolean isParallel() {
    return parallel;
  }

  public void setParallel(boolean parallel) {
    this.parallel = parallel;
  }

  /** {@inheritDoc} */
  @Override
  public int numAtoms() {
    return numAtoms;
  }

  /** {@inheritDoc} */
  @Override
  public int numCoordsets() {
    return coordsets.size();
  }

  /** {@inheritDoc} */
  @Override
  public double[][] getCoordinates() {
    return reference == null ? null : copyCoordinates(reference);
  }

  /** {@inheritDoc} */
  @Override
  public void setCoordinates(double[][] coordinates) {
    checkCoordinates(coordinates);
    double[][] xyz = copyCoordinates(coordinates);
    numAtoms = xyz.length;
    reference = xyz;
  }

  /** {@inheritDoc} */
  @Override
  public void addCoordset(double[][] coordinates) {
    checkCoordinates(coordinates);
    appendCoordset(copyCoordinates(coordinates), null);
  }

  /** {@inheritDoc} */
  @Override
  public void addCoordsets(double[][][] coordinates) {
    if (coordinates == null) {
      throw new IllegalArgumentException(" Coordinate sets must not be null.");
    }
    for (double[][] xyz : coordinates) {
      checkCoordinates(xyz);
      if (numAtoms == 0 && xyz.length != coordinates[0].length) {
        throw new ShapeMismatchException(
            format(" Coordinate sets with %d and %d atoms cannot be added together.",
                coordinates[0].length, xyz.length), coordinates[0].length, xyz.length);
      }
    }
    for (double[][] xyz : coordinates) {
      appendCoordset(copyCoordinates(xyz), null);
    }
  }

  /**
   * Append an already validated and copied coordinate set.
   *
   * @param xyz     [numAtoms][3] coordinates owned by this ensemble from now on.
   * @param weights per atom weights for the new set, or null for the default.
   */
  protected void appendCoordset(double[][] xyz, double[] weights) {
    if (numAtoms == 0) {
      numAtoms = xyz.length;
    }
    if (reference == null) {
      reference = copyCoordinates(xyz);
    }
    coordsets.add(xyz);
  }

  /** {@inheritDoc} */
  @Override
  public double[][][] getCoordsets() {
    if (coordsets.isEmpty()) {
      return null;
    }
    double[][][] xyz = new double[coordsets.size()][][];
    for (int i = 0; i < xyz.length; i++) {
      xyz[i] = copyCoordinates(coordsets.get(i));
    }
    return xyz;
  }

  /** {@inheritDoc} */
  @Override
  public double[][][] getCoordsets(int... indices) {
    if (coordsets.isEmpty()) {
      return null;
    }
    double[][][] xyz = new double[indices.length][][];
    for (int i = 0; i < indices.length; i++) {
      xyz[i] = copyCoordinates(coordsets.get(checkIndex(indices[i])));
    }
    return xyz;
  }

  /** {@inheritDoc} */
  @Override
  public double[][] getCoordset(int index) {
    return copyCoordinates(coordsets.get(checkIndex(index)));
  }

  /** {@inheritDoc} */
  @Override
  public void delCoordset(int... indices) {
    if (indices == null || indices.length == 0) {
      return;
    }
    int n = coordsets.size();
    // Check every index before anything is removed.
    boolean[] remove = new boolean[n];
    for (int index : indices) {
      remove[checkIndex(index)] = true;
    }
    List<double[][]> kept = new ArrayList<>(n);
    for (int i = 0; i < n; i++) {
      if (!remove[i]) {
        kept.add(coordsets.get(i));
      }
    }
    coordsets.clear();
    coordsets.addAll(kept);
    deleteWeights(remove);
    if (logger.isLoggable(Level.FINE)) {
      logger.fine(format(" Deleted %d of %d coordinate sets from %s.",
          n - kept.size(), n, title));
    }
  }

  /** {@inheritDoc} */
  @Override
  public void delCoordsets(int start, int end) {
    delCoordset(range(start, end));
  }

  /**
   * Remove the weights of deleted coordinate sets.
   *
   * @param removed flags, indexed by the coordinate set indices before deletion.
   */
  protected void deleteWeights(boolean[] removed) {
    // Uniform weights are not tied to coordinate sets.
  }

  /** {@inheritDoc} */
  @Override
  public Iterable<double[][]> iterCoordsets() {
    return () -> new Iterator<>() {
      private int next = 0;

      @Override
      public boolean hasNext() {
        return next < coordsets.size();
      }

      @Override
      public double[][] next() {
        if (!hasNext()) {
          throw new NoSuchElementException();
        }
        return copyCoordinates(coordsets.get(next++));
      }
    };
  }

  /**
   * Iterate over views of the conformations in index order.
   *
   * @return an Iterator of Conformation views.
   */
  @Override
  public Iterator<Conformation> iterator() {
    return new Iterator<>() {
      private int next = 0;

      @Override
      public boolean hasNext() {
        return next < coordsets.size();
      }

      @Override
      public Conformation next() {
        if (!hasNext()) {
          throw new NoSuchElementException();
        }
        return getConformation(next++);
      }
    };
  }

  /**
   * The weights of one conformation as a copy.
   *
   * @param index coordinate set index.
   * @return per atom weights, or null if the atoms are not weighted.
   */
  public abstract double[] getConformationWeights(int index);

  /**
   * The weights used to fit one conformation. The array is not copied and must not be modified.
   *
   * @param index coordinate set index (already checked).
   * @return per atom weights, or null for uniform weights.
   */
  protected abstract double[] fitWeights(int index);

  /** {@inheritDoc} */
  @Override
  public abstract AbstractEnsemble select(int... indices);

  /** {@inheritDoc} */
  @Override
  public AbstractEnsemble selectRange(int start, int end) {
    return select(range(start, end));
  }

  /**
   * A copy of this ensemble (all coordinate sets).
   *
   * @return a new ensemble.
   */
  public AbstractEnsemble copy() {
    return selectRange(0, coordsets.size());
  }

  /** {@inheritDoc} */
  @Override
  public abstract AbstractEnsemble concatenate(ConformationEnsemble other);

  /**
   * Copy the title, atom count and reference coordinates of this ensemble into a new ensemble.
   *
   * @param ensemble the new ensemble.
   */
  protected void copyReferenceTo(AbstractEnsemble ensemble) {
    ensemble.numAtoms = numAtoms;
    ensemble.reference = reference == null ? null : copyCoordinates(reference);
    ensemble.parallel = parallel;
  }

  /** {@inheritDoc} */
  @Override
  public void superpose() {
    int n = coordsets.size();
    if (n == 0) {
      logger.fine(format(" No coordinate sets to superpose in %s.", title));
      return;
    }
    checkReference();
    // Check all weights first so a degenerate conformation leaves the ensemble unchanged.
    for (int i = 0; i < n; i++) {
      Superpose.totalWeight(fitWeights(i), numAtoms);
    }
    IntStream conformations = IntStream.range(0, n);
    if (parallel) {
      conformations = conformations.parallel();
    }
    double[] rmsd = conformations.mapToDouble(
        (int i) -> Superpose.superpose(coordsets.get(i), reference, fitWeights(i))).toArray();
    logger.info(format(" Superposed %d conformations of %s.", n, title));
    logRMSDs(rmsd);
  }

  /** {@inheritDoc} */
  @Override
  public double[] getRMSDs() {
    int n = coordsets.size();
    if (n == 0) {
      return new double[0];
    }
    checkReference();
    IntStream conformations = IntStream.range(0, n);
    if (parallel) {
      conformations = conformations.parallel();
    }
    return conformations.mapToDouble(
        (int i) -> Superpose.rmsd(coordsets.get(i), reference, fitWeights(i))).toArray();
  }

  /**
   * Weighted RMSD of one conformation from the reference coordinates.
   *
   * @param index coordinate set index.
   * @return the RMSD.
   */
  public double getRMSD(int index) {
    int i = checkIndex(index);
    checkReference();
    return Superpose.rmsd(coordsets.get(i), reference, fitWeights(i));
  }

  /**
   * Differences between one conformation and the reference coordinates.
   *
   * @param index coordinate set index.
   * @return [numAtoms][3] deviations.
   */
  public double[][] getDeviations(int index) {
    int i = checkIndex(index);
    checkReference();
    return subtract(coordsets.get(i), reference);
  }

  /**
   * Differences between every conformation and the reference coordinates.
   *
   * @return [numCoordsets][numAtoms][3] deviations, or null if there are no coordinate sets.
   */
  public double[][][] getDeviations() {
    if (coordsets.isEmpty()) {
      return null;
    }
    checkReference();
    double[][][] deviations = new double[coordsets.size()][][];
    for (int i = 0; i < deviations.length; i++) {
      deviations[i] = subtract(coordsets.get(i), reference);
    }
    return deviations;
  }

  /**
   * Weighted mean position of every atom over the coordinate sets. An atom without weight in
   * every set takes its reference position.
   *
   * @return [numAtoms][3] mean coordinates, or null if there are no coordinate sets.
   */
  public double[][] getMeanCoordinates() {
    if (coordsets.isEmpty()) {
      return null;
    }
    return meanCoordinates(reference);
  }

  /**
   * Root mean square fluctuation of every atom about its weighted mean position. Superpose the
   * ensemble first to exclude rigid-body motion.
   *
   * @return per atom RMSF, or null if there are no coordinate sets.
   */
  public double[] getRMSFs() {
    if (coordsets.isEmpty()) {
      return null;
    }
    double[][] mean = meanCoordinates(reference);
    double[] msf = new double[numAtoms];
    double[] totals = new double[numAtoms];
    for (int c = 0; c < coordsets.size(); c++) {
      double[][] xyz = coordsets.get(c);
      double[] w = fitWeights(c);
      for (int a = 0; a < numAtoms; a++) {
        double wa = w == null ? 1.0 : w[a];
        if (wa == 0.0) {
          continue;
        }
        double dx = xyz[a][0] - mean[a][0];
        double dy = xyz[a][1] - mean[a][1];
        double dz = xyz[a][2] - mean[a][2];
        msf[a] += wa * (dx * dx + dy * dy + dz * dz);
        totals[a] += wa;
      }
    }
    for (int a = 0; a < numAtoms; a++) {
      msf[a] = totals[a] > 0.0 ? sqrt(msf[a] / totals[a]) : 0.0;
    }
    return msf;
  }

  /**
   * Iterative superposition. Conformations are superposed onto the reference coordinates, their
   * weighted mean becomes the next fit target, and this repeats until the RMSD between successive
   * targets drops below the <code>iterpose-rmsd</code> property or
   * <code>iterpose-max-iterations</code> cycles are done. The reference coordinates are not
   * changed.
   *
   * @return the final fit target (mean coordinates), or null if there are no coordinate sets.
   */
  public double[][] iterpose() {
    if (coordsets.isEmpty()) {
      return null;
    }
    checkReference();
    double threshold = properties.getDouble(ITERPOSE_RMSD, DEFAULT_ITERPOSE_RMSD);
    int maxIterations = properties.getInt(ITERPOSE_MAX_ITERATIONS,
        DEFAULT_ITERPOSE_MAX_ITERATIONS);
    for (int i = 0; i < coordsets.size(); i++) {
      Superpose.totalWeight(fitWeights(i), numAtoms);
    }

    double[][] target = copyCoordinates(reference);
    double change = Double.POSITIVE_INFINITY;
    int iteration = 0;
    while (iteration < maxIterations && change >= threshold) {
      double[][] fitTarget = target;
      IntStream conformations = IntStream.range(0, coordsets.size());
      if (parallel) {
        conformations = conformations.parallel();
      }
      conformations.forEach(
          (int i) -> Superpose.superpose(coordsets.get(i), fitTarget, fitWeights(i)));
      double[][] mean = meanCoordinates(target);
      change = Superpose.rmsd(mean, target, null);
      target = mean;
      iteration++;
      if (logger.isLoggable(Level.FINE)) {
        logger.fine(format(" Iteration %3d: RMSD change of the mean %12.6f", iteration, change));
      }
    }
    if (change < threshold) {
      logger.info(format(" Iterative superposition of %s converged after %d iterations.",
          title, iteration));
    } else {
      logger.warning(format(" Iterative superposition of %s stopped after %d iterations "
          + "(RMSD change %10.6f > %10.6f).", title, iteration, change, threshold));
    }
    return target;
  }

  /**
   * Weighted mean coordinates over all sets.
   *
   * @param fallback positions for atoms that carry no weight (may be null).
   * @return [numAtoms][3] mean coordinates.
   */
  private double[][] meanCoordinates(double[][] fallback) {
    double[][] mean = new double[numAtoms][3];
    double[] totals = new double[numAtoms];
    for (int c = 0; c < coordsets.size(); c++) {
      double[][] xyz = coordsets.get(c);
      double[] w = fitWeights(c);
      for (int a = 0; a < numAtoms; a++) {
        double wa = w == null ? 1.0 : w[a];
        if (wa == 0.0) {
          continue;
        }
        mean[a][0] += wa * xyz[a][0];
        mean[a][1] += wa * xyz[a][1];
        mean[a][2] += wa * xyz[a][2];
        totals[a] += wa;
      }
    }
    for (int a = 0; a < numAtoms; a++) {
      if (totals[a] > 0.0) {
        mean[a][0] /= totals[a];
        mean[a][1] /= totals[a];
        mean[a][2] /= totals[a];
      } else if (fallback != null) {
        mean[a] = fallback[a].clone();
      }
    }
    return mean;
  }

  private void logRMSDs(double[] rmsd) {
    if (logger.isLoggable(Level.FINE)) {
      StringBuilder sb = new StringBuilder(" Conformation  RMSD after superposition\n");
      for (int i = 0; i < rmsd.length; i++) {
        sb.append(format(" %12d  %12.6f\n", i, rmsd[i]));
      }
      logger.fine(sb.toString());
    }
  }

  private void checkReference() {
    if (reference == null) {
      throw new IllegalStateException(format(" Ensemble %s has no reference coordinates.", title));
    }
  }

  /**
   * Check that an array has one row of three coordinates per atom.
   *
   * @param coordinates the array to check.
   * @throws ShapeMismatchException if the array has the wrong shape.
   */
  protected void checkCoordinates(double[][] coordinates) {
    if (coordinates == null) {
      throw new IllegalArgumentException(" Coordinates must not be null.");
    }
    int n = coordinates.length;
    if (n == 0 || (numAtoms > 0 && n != numAtoms)) {
      throw new ShapeMismatchException(
          format(" Found coordinates for %d atoms; %s has %d atoms.", n, title, numAtoms),
          numAtoms, n);
    }
    for (double[] xyz : coordinates) {
      if (xyz == null || xyz.length != 3) {
        throw new ShapeMismatchException(
            format(" Coordinates of %s must have 3 columns.", title), 3,
            xyz == null ? 0 : xyz.length);
      }
    }
  }

  /**
   * Check that a weight array has one entry per atom and no negative entries.
   *
   * @param weights the weights to check.
   * @param n       the number of atoms the weights must match.
   * @throws ShapeMismatchException if the length is wrong.
   */
  protected void checkWeights(double[] weights, int n) {
    if (weights.length != n) {
      throw new ShapeMismatchException(
          format(" Found %d weights; %s has %d atoms.", weights.length, title, n),
          n, weights.length);
    }
    for (int i = 0; i < weights.length; i++) {
      if (!(weights[i] >= 0.0)) {
        throw new IllegalArgumentException(
            format(" Weight %d (%s) must be non-negative.", i, weights[i]));
      }
    }
  }

  /**
   * Check a coordinate set index. Negative indices count from the end.
   *
   * @param index the index.
   * @return an index in [0, numCoordsets).
   */
  protected int checkIndex(int index) {
    int n = coordsets.size();
    int i = index < 0 ? index + n : index;
    if (i < 0 || i >= n) {
      throw new IndexOutOfBoundsException(
          format(" Index %d is out of range for %d coordinate sets.", index, n));
    }
    return i;
  }

  /**
   * Check that two ensembles can be concatenated.
   *
   * @param other the ensemble to append.
   */
  protected void checkDimensions(ConformationEnsemble other) {
    int m = other.numAtoms();
    if (numAtoms > 0 && m > 0 && numAtoms != m) {
      throw new DimensionMismatchException(numAtoms, m);
    }
  }

  private int[] range(int start, int end) {
    int n = coordsets.size();
    if (start < 0 || end > n || start > end) {
      throw new IndexOutOfBoundsException(
          format(" Range [%d, %d) is out of range for %d coordinate sets.", start, end, n));
    }
    return IntStream.range(start, end).toArray();
  }

  private static double[][] subtract(double[][] x1, double[][] x2) {
    double[][] d = new double[x1.length][3];
    for (int i = 0; i < x1.length; i++) {
      d[i][0] = x1[i][0] - x2[i][0];
      d[i][1] = x1[i][1] - x2[i][1];
      d[i][2] = x1[i][2] - x2[i][2];
    }
    return d;
  }

  /**
   * Deep copy of a coordinate array.
   *
   * @param xyz [n][3] coordinates.
   * @return a copy.
   */
  static double[][] copyCoordinates(double[][] xyz) {
    double[][] copy = new double[xyz.length][];
    for (int i = 0; i < xyz.length; i++) {
      copy[i] = xyz[i].clone();
    }
    return copy;
  }

  @Override
  public String toString() {
    return format("%s (%d conformations, %d atoms)", title, coordsets.size(), numAtoms);
  }
}
