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
package conformx.utilities;

import static java.lang.String.format;

import java.io.File;
import java.io.IOException;
import java.util.Arrays;
import java.util.Iterator;
import java.util.logging.Level;
import java.util.logging.Logger;

import org.apache.commons.configuration2.CompositeConfiguration;
import org.apache.commons.configuration2.PropertiesConfiguration;
import org.apache.commons.configuration2.SystemConfiguration;
import org.apache.commons.configuration2.builder.FileBasedConfigurationBuilder;
import org.apache.commons.configuration2.builder.fluent.Parameters;
import org.apache.commons.configuration2.ex.ConfigurationException;
import org.apache.commons.io.FilenameUtils;

/**
 * Loads the properties that control ensemble analysis.
 *
 * @author Michael J. Schnieders
 * @since 1.0
 */
public final class EnsembleProperties {

  private static final Logger logger = Logger.getLogger(EnsembleProperties.class.getName());

  /** Process conformations in parallel during superposition and RMSD calculation. */
  public static final String ENSEMBLE_PARALLEL = "ensemble-parallel";
  /** RMSD between successive fit targets that ends iterative superposition. */
  public static final String ITERPOSE_RMSD = "iterpose-rmsd";
  /** Upper bound on the number of iterative superposition cycles. */
  public static final String ITERPOSE_MAX_ITERATIONS = "iterpose-max-iterations";

  /** Default value of the <code>iterpose-rmsd</code> property. */
  public static final double DEFAULT_ITERPOSE_RMSD = 1.0e-4;
  /** Default value of the <code>iterpose-max-iterations</code> property. */
  public static final int DEFAULT_ITERPOSE_MAX_ITERATIONS = 100;

  /** Environment variable that names a system wide property file. */
  public static final String CONFORMX_PROPERTIES = "CONFORMX_PROPERTIES";

  private EnsembleProperties() {
    // Prevent instantiation.
  }

  /**
   * This method sets up configuration properties in the following precedence order:
   * <p>
   * 1.) Java system properties a.) -Dkey=value from the Java command line b.)
   * System.setProperty("key","value") within Java code.
   * <p>
   * 2.) Structure specific properties (for example trajectory.properties)
   * <p>
   * 3.) User specific properties (~/.conformx/conformx.properties)
   * <p>
   * 4.) System wide properties (file defined by environment variable CONFORMX_PROPERTIES)
   *
   * @param file the structure or trajectory the properties belong to (may be null).
   * @return a {@link org.apache.commons.configuration2.CompositeConfiguration} object.
   */
  public static CompositeConfiguration loadProperties(File file) {

    // Command line options take precedence.
    CompositeConfiguration properties = new CompositeConfiguration();

    PropertiesConfiguration systemConfiguration = new PropertiesConfiguration();
    systemConfiguration.append(new SystemConfiguration());
    systemConfiguration.setHeader("JVM system properties (i.e. command line -Dkey=value pairs).");
    properties.addConfiguration(systemConfiguration);

    // Structure specific options are 2nd.
    if (file != null) {
      String basename = FilenameUtils.removeExtension(file.getAbsolutePath());
      File structurePropFile = new File(basename + ".properties");
      if (structurePropFile.exists() && structurePropFile.canRead()) {
        PropertiesConfiguration configuration = readPropertyFile(structurePropFile);
        if (configuration != null) {
          configuration.setHeader("Structure properties from (" + structurePropFile + ").");
          properties.addConfiguration(configuration);
          try {
            properties.addProperty("propertyFile", structurePropFile.getCanonicalPath());
          } catch (IOException e) {
            logger.log(Level.WARNING, " Could not resolve {0}.", structurePropFile);
          }
        }
      }
    }

    // User specific options are 3rd.
    String filename = System.getProperty("user.home") + File.separator
        + ".conformx" + File.separator + "conformx.properties";
    File userPropFile = new File(filename);
    if (userPropFile.exists() && userPropFile.canRead()) {
      PropertiesConfiguration configuration = readPropertyFile(userPropFile);
      if (configuration != null) {
        configuration.setHeader("ConformX user property file (" + filename + ").");
        properties.addConfiguration(configuration);
      }
    }

    // System wide options are last.
    filename = System.getenv(CONFORMX_PROPERTIES);
    if (filename != null) {
      File systemPropFile = new File(filename);
      if (systemPropFile.exists() && systemPropFile.canRead()) {
        PropertiesConfiguration configuration = readPropertyFile(systemPropFile);
        if (configuration != null) {
          configuration.setHeader("Environment variable CONFORMX_PROPERTIES (" + filename + ").");
          properties.addConfiguration(configuration);
        }
      }
    }

    // Echo the interpolated configuration.
    if (logger.isLoggable(Level.FINE)) {
      Iterator<String> i = properties.getKeys();
      StringBuilder sb = new StringBuilder();
      sb.append(format("\n %-30s %s\n", "Property", "Value"));
      while (i.hasNext()) {
        String s = i.next();
        sb.append(format(" %-30s %s\n", s, Arrays.toString(properties.getList(s).toArray())));
      }
      logger.fine(sb.toString());
    }

    return properties;
  }

  /**
   * Read a single property file.
   *
   * @param propertyFile the file to read.
   * @return the parsed configuration, or null if it could not be read.
   */
  private static PropertiesConfiguration readPropertyFile(File propertyFile) {
    try {
      FileBasedConfigurationBuilder<PropertiesConfiguration> builder =
          new FileBasedConfigurationBuilder<>(PropertiesConfiguration.class)
              .configure(new Parameters().properties()
                  .setFile(propertyFile)
                  .setThrowExceptionOnMissing(true)
                  .setIncludesAllowed(false));
      return builder.getConfiguration();
    } catch (ConfigurationException e) {
      logger.log(Level.WARNING, " Error loading {0}.", propertyFile);
      return null;
    }
  }
}
