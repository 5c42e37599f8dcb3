package io.sigmaremap.vertical;

/*
 * Copyright (c) nosqlbench
 *
 * Licensed under the Apache License, Version 2.0 (the "License");
 * you may not use this file except in compliance with the License.
 * You may obtain a copy of the License at
 *
 *   http://www.apache.org/licenses/LICENSE-2.0
 *
 * Unless required by applicable law or agreed to in writing,
 * software distributed under the License is distributed on an
 * "AS IS" BASIS, WITHOUT WARRANTIES OR CONDITIONS OF ANY
 * KIND, either express or implied.  See the License for the
 * specific language governing permissions and limitations
 * under the License.
 */


import io.sigmaremap.dataset.Attributes;
import io.sigmaremap.dataset.DataType;
import io.sigmaremap.dataset.DatasetException;
import io.sigmaremap.dataset.LabeledDataset;
import io.sigmaremap.dataset.Variable;
import io.sigmaremap.dataset.hdf5.Hdf5Dataset;
import io.sigmaremap.units.UnitsConverter;
import org.apache.commons.math3.analysis.interpolation.LinearInterpolator;
import org.apache.commons.math3.analysis.polynomials.PolynomialSplineFunction;
import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;

import java.nio.file.Path;
import java.util.ArrayList;
import java.util.Arrays;
import java.util.HashSet;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.Set;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.Future;
import java.util.concurrent.ThreadFactory;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicInteger;

/// Remaps variables on fixed pressure levels onto a hybrid sigma-pressure grid.
///
/// Every variable indexed by exactly one pressure coordinate is interpolated, column by
/// column, to the pressures `a + b * sp` of the grid, where `sp` is the local surface
/// pressure. Source levels below the surface are ignored; the surface itself is added to
/// each column, with the value of a matching surface field when one is aliased to the
/// variable. Outside the span of a column the profile is held at the value of its highest
/// (lowest pressure) sample.
///
/// The remapped variables share a new `sigma_level` dimension, and a variable `p` records
/// the pressure of each sigma level at each grid point. All other variables are copied as they
/// are.
///
/// A remapper holds only its coefficients and may be shared between threads.
public class VerticalRemapper {
  private static final Logger logger = LogManager.getLogger(VerticalRemapper.class);

  public static final String SIGMA_LEVEL = "sigma_level";
  public static final String PRESSURE_VARIABLE = "p";
  public static final String AIR_PRESSURE = "air_pressure";
  public static final String DEFAULT_SURFACE_PRESSURE = "sp";
  public static final Map<String, String> DEFAULT_SURFACE_ALIASES = Map.of("t", "t2m");

  private final HybridCoefficients coefficients;
  private final int threads;

  public VerticalRemapper(HybridCoefficients coefficients) {
    this(coefficients, 1);
  }

  /// @param coefficients the target grid
  /// @param threads how many threads interpolate columns; 1 interpolates on the calling thread
  public VerticalRemapper(HybridCoefficients coefficients, int threads) {
    if (threads < 1) {
      throw new IllegalArgumentException("threads must be at least 1, not " + threads);
    }
    this.coefficients = coefficients;
    this.threads = threads;
  }

  public HybridCoefficients getCoefficients() {
    return coefficients;
  }

  public int getThreads() {
    return threads;
  }

  /// The pressures of the sigma levels over one grid point.
  /// @param surfacePressure the surface pressure, in `units`
  /// @param units the pressure units of the result
  /// @param converter the units registry
  /// @return one pressure per output level
  public double[] pressure(double surfacePressure, String units, UnitsConverter converter) {
    return coefficients.pressures(converter.convert(coefficients.units(), units), surfacePressure);
  }

  /// The sigma level pressures over a column, and the column's values at them.
  /// @param pressures the sigma level pressures
  /// @param values the interpolated values
  public record RemappedColumn(double[] pressures, double[] values) {
  }

  /// Interpolate one column linearly onto the sigma levels over it.
  /// @param values the column values
  /// @param pressures the pressure of each value, strictly monotonic, in `units`
  /// @param surfacePressure the surface pressure over the column, in `units`
  /// @param units the pressure units
  /// @param converter the units registry
  /// @param fillValue the result outside the span of `pressures`
  /// @return the sigma level pressures and the values at them
  public RemappedColumn remapColumn(double[] values, double[] pressures, double surfacePressure,
                                    String units, UnitsConverter converter, double fillValue) {
    if (values.length != pressures.length) {
      throw new IllegalArgumentException(
          values.length + " values cannot be paired with " + pressures.length + " pressures");
    }
    double[] x = pressures;
    double[] y = values;
    if (x.length > 1 && x[0] > x[x.length - 1]) {
      x = reversed(x);
      y = reversed(y);
    }
    double[] target = pressure(surfacePressure, units, converter);
    return new RemappedColumn(target, interpolate(x, y, target, fillValue));
  }

  private static double[] interpolate(double[] x, double[] y, double[] target, double fillValue) {
    double[] result = new double[target.length];
    if (x.length < 2) {
      Arrays.fill(result, fillValue);
      return result;
    }
    PolynomialSplineFunction profile = new LinearInterpolator().interpolate(x, y);
    for (int i = 0; i < target.length; i++) {
      result[i] = profile.isValidPoint(target[i]) ? profile.value(target[i]) : fillValue;
    }
    return result;
  }

  private static double[] reversed(double[] values) {
    double[] result = new double[values.length];
    for (int i = 0; i < values.length; i++) {
      result[i] = values[values.length - 1 - i];
    }
    return result;
  }

  /// The names of the variables remapped onto sigma levels and of those copied unchanged.
  public record RemapSummary(List<String> remapped, List<String> copied) {
  }

  /// Remap HDF5 files. The output is only written if the whole remap succeeds.
  /// @see #remapAll(LabeledDataset, LabeledDataset, LabeledDataset, String, Map, UnitsConverter)
  public RemapSummary remapAll(Path levelPath, Path surfacePath, Path outputPath, String surfacePressure,
                               Map<String, String> surfaceAliases, UnitsConverter converter) {
    try (Hdf5Dataset level = Hdf5Dataset.openForRead(levelPath);
         Hdf5Dataset surface = Hdf5Dataset.openForRead(surfacePath)) {
      Hdf5Dataset output = Hdf5Dataset.create(outputPath);
      RemapSummary summary;
      try {
        summary = remapAll(level, surface, output, surfacePressure, surfaceAliases, converter);
      } catch (RuntimeException e) {
        output.discard();
        throw e;
      }
      output.close();
      return summary;
    }
  }

  /// Remap every pressure level variable of a dataset.
  /// @param level the variables on pressure levels
  /// @param surface the surface pressure, and surface fields for aliased variables
  /// @param output an empty, writable dataset receiving the result
  /// @param surfacePressure the name of the surface pressure variable in `surface`
  /// @param surfaceAliases level variable names mapped to the surface fields standing for them
  /// @param converter the units registry
  /// @return which variables were remapped and which copied
  public RemapSummary remapAll(LabeledDataset level, LabeledDataset surface, LabeledDataset output,
                               String surfacePressure, Map<String, String> surfaceAliases,
                               UnitsConverter converter) {
    List<Variable> dimensionVariables = level.dimensionVariables();
    Set<String> pressureNames = new HashSet<>();
    for (Variable coordinate : level.pressureCoordinates(converter)) {
      pressureNames.add(coordinate.getName());
    }
    logger.info("remapping {} onto {} sigma levels (pressure coordinates {})",
        level.getName(), coefficients.levelCount(), pressureNames);

    List<String> remapped = new ArrayList<>();
    List<String> copied = new ArrayList<>();
    boolean pressureCreated = false;
    for (Variable variable : level.getVariables()) {
      if (dimensionVariables.contains(variable)) {
        continue;
      }
      List<Integer> pressureAxes = new ArrayList<>();
      List<String> dimensions = variable.getDimensions();
      for (int axis = 0; axis < dimensions.size(); axis++) {
        String dimension = dimensions.get(axis);
        if (pressureNames.contains(dimension) && !dimension.equals(variable.getName())) {
          pressureAxes.add(axis);
        }
      }
      if (pressureAxes.size() != 1) {
        if (pressureAxes.size() > 1) {
          logger.warn("{} has {} pressure dimensions; copying it unchanged", variable, pressureAxes.size());
        }
        output.copyVariable(variable, level);
        copied.add(variable.getName());
        continue;
      }
      boolean createPressure = !pressureCreated;
      remapVariable(variable, pressureAxes.get(0), level, surface, output, surfacePressure,
          surfaceAliases, converter, createPressure);
      pressureCreated = true;
      remapped.add(variable.getName());
    }
    logger.info("remapped {} variables, copied {}", remapped.size(), copied.size());
    return new RemapSummary(remapped, copied);
  }

  private void remapVariable(Variable variable, int pressureAxis, LabeledDataset level,
                             LabeledDataset surface, LabeledDataset output, String surfacePressure,
                             Map<String, String> surfaceAliases, UnitsConverter converter,
                             boolean createPressure) {
    String name = variable.getName();
    Variable coordinate = level.getVariable(variable.getDimensions().get(pressureAxis));
    String pressureUnits = coordinate.getUnits().orElseThrow(
        () -> new MissingCoordinateException(name, coordinate.getName(), "it has no units"));
    LevelOrder levels = LevelOrder.of(name, coordinate);
    int levelCount = coefficients.levelCount();

    List<String> names = new ArrayList<>(variable.getDimensions());
    names.set(pressureAxis, SIGMA_LEVEL);
    if (!output.hasDimension(SIGMA_LEVEL)) {
      Variable sigma = output.createCoordinate(SIGMA_LEVEL, levelCount, DataType.INT,
          Map.of(Attributes.LONG_NAME, "hybrid sigma-pressure level"));
      double[] index = new double[levelCount];
      for (int i = 0; i < levelCount; i++) {
        index[i] = i + 1;
      }
      sigma.setValues(index);
    }
    for (String dimension : variable.getDimensions()) {
      if (!dimension.equals(coordinate.getName())) {
        output.ensureDimension(level.getDimension(dimension), level);
      }
    }
    Variable pressureOut = null;
    if (createPressure) {
      pressureOut = output.createVariable(PRESSURE_VARIABLE, DataType.DOUBLE, names,
          Map.of(Attributes.UNITS, pressureUnits, Attributes.STANDARD_NAME, AIR_PRESSURE));
    }
    Variable remappedOut = output.createVariable(name, variable.getDataType(), names);
    for (String attr : variable.attributeNames()) {
      if (!attr.equals(Attributes.FILL_VALUE)) {
        output.copyAttribute(variable, attr);
      }
    }

    int[] shape = variable.shape();
    int outer = 1;
    for (int axis = 0; axis < pressureAxis; axis++) {
      outer *= shape[axis];
    }
    int inner = 1;
    for (int axis = pressureAxis + 1; axis < shape.length; axis++) {
      inner *= shape[axis];
    }
    int columnCount = outer * inner;

    double[] sp = surfaceField(surface, surfacePressure, pressureUnits, columnCount, converter, name);
    double[] surfaceValues = null;
    String alias = surfaceAliases.get(name);
    if (alias != null) {
      Variable surfaceVariable = surface.findVariable(alias).orElseThrow(() -> new DatasetException(
          "surface dataset " + surface.getName() + " has no variable '" + alias + "' for " + name));
      Optional<String> targetUnits = variable.getUnits();
      Optional<String> aliasUnits = surfaceVariable.getUnits();
      double conversion = targetUnits.isPresent() && aliasUnits.isPresent()
                          ? converter.convert(aliasUnits.get(), targetUnits.get()) : 1.0d;
      surfaceValues = scaled(surfaceVariable, conversion, columnCount, name);
      logger.debug("using {} as the surface value of {}", alias, name);
    }

    ColumnTask task = new ColumnTask(variable.getUnpacked(), levels, sp, surfaceValues,
        converter.convert(coefficients.units(), pressureUnits), inner, levelCount);
    runColumns(task, columnCount, name);

    remappedOut.setUnpacked(task.values);
    if (pressureOut != null) {
      pressureOut.setValues(task.pressures);
    }
    logger.debug("remapped {} over {} columns", variable, columnCount);
  }

  private static double[] surfaceField(LabeledDataset surface, String surfacePressure, String pressureUnits,
                                       int columnCount, UnitsConverter converter, String variable) {
    Variable field = surface.findVariable(surfacePressure).orElseThrow(() -> new DatasetException(
        "surface dataset " + surface.getName() + " has no surface pressure variable '" + surfacePressure + "'"));
    String units = field.getUnits().orElseThrow(() -> new DatasetException(
        "surface pressure variable " + surfacePressure + " has no units"));
    return scaled(field, converter.convert(units, pressureUnits), columnCount, variable);
  }

  private static double[] scaled(Variable field, double factor, int columnCount, String variable) {
    if (field.size() != columnCount) {
      throw new DatasetException(String.format(
          "surface field %s has %d points but %s has %d columns",
          field.getName(), field.size(), variable, columnCount));
    }
    double[] values = field.getUnpacked();
    for (int i = 0; i < values.length; i++) {
      values[i] *= factor;
    }
    return values;
  }

  private void runColumns(ColumnTask task, int columnCount, String variable) {
    if (threads == 1 || columnCount < 2 * threads) {
      task.run(0, columnCount);
      return;
    }
    ExecutorService executor = Executors.newFixedThreadPool(threads, new ThreadFactory() {
      private final AtomicInteger counter = new AtomicInteger(0);

      @Override
      public Thread newThread(Runnable r) {
        Thread t = new Thread(r, "remap-worker-" + counter.incrementAndGet());
        t.setDaemon(true);
        return t;
      }
    });
    try {
      int chunk = (columnCount + threads - 1) / threads;
      List<Future<?>> futures = new ArrayList<>();
      for (int start = 0; start < columnCount; start += chunk) {
        int from = start;
        int to = Math.min(columnCount, start + chunk);
        futures.add(executor.submit(() -> task.run(from, to)));
      }
      for (Future<?> future : futures) {
        try {
          future.get();
        } catch (InterruptedException e) {
          Thread.currentThread().interrupt();
          throw new DatasetException("interrupted while remapping " + variable, e);
        } catch (ExecutionException e) {
          if (e.getCause() instanceof RuntimeException cause) {
            throw cause;
          }
          throw new DatasetException("failed to remap " + variable, e.getCause());
        }
      }
    } finally {
      executor.shutdown();
      try {
        if (!executor.awaitTermination(60, TimeUnit.SECONDS)) {
          executor.shutdownNow();
        }
      } catch (InterruptedException e) {
        executor.shutdownNow();
        Thread.currentThread().interrupt();
      }
    }
  }

  /// The source levels of a pressure coordinate, ordered by increasing pressure.
  private record LevelOrder(double[] pressures, int[] index) {

    static LevelOrder of(String variable, Variable coordinate) {
      double[] values = coordinate.getUnpacked();
      if (values.length == 0) {
        throw new MissingCoordinateException(variable, coordinate.getName(), "it has no levels");
      }
      boolean descending = values.length > 1 && values[0] > values[values.length - 1];
      double[] pressures = new double[values.length];
      int[] index = new int[values.length];
      for (int i = 0; i < values.length; i++) {
        index[i] = descending ? values.length - 1 - i : i;
        pressures[i] = values[index[i]];
        if (Double.isNaN(pressures[i]) || (i > 0 && pressures[i] <= pressures[i - 1])) {
          throw new MissingCoordinateException(variable, coordinate.getName(),
              "its values are not strictly monotonic");
        }
      }
      return new LevelOrder(pressures, index);
    }

    /// @return the number of levels with a pressure strictly below `surfacePressure`
    int aboveGround(double surfacePressure) {
      int low = 0;
      int high = pressures.length;
      while (low < high) {
        int mid = (low + high) >>> 1;
        if (pressures[mid] < surfacePressure) {
          low = mid + 1;
        } else {
          high = mid;
        }
      }
      return low;
    }
  }

  /// Interpolation of a range of columns. Each column writes only its own output slots.
  private final class ColumnTask {
    private final double[] source;
    private final LevelOrder levels;
    private final double[] surfacePressure;
    private final double[] surfaceValues;
    private final double offsetScale;
    private final int inner;
    private final int levelCount;
    final double[] values;
    final double[] pressures;

    ColumnTask(double[] source, LevelOrder levels, double[] surfacePressure, double[] surfaceValues,
               double offsetScale, int inner, int levelCount) {
      this.source = source;
      this.levels = levels;
      this.surfacePressure = surfacePressure;
      this.surfaceValues = surfaceValues;
      this.offsetScale = offsetScale;
      this.inner = inner;
      this.levelCount = levelCount;
      this.values = new double[surfacePressure.length * levelCount];
      this.pressures = new double[surfacePressure.length * levelCount];
    }

    void run(int from, int to) {
      int sourceLevels = levels.pressures().length;
      for (int column = from; column < to; column++) {
        int o = column / inner;
        int i = column % inner;
        int sourceBase = o * sourceLevels * inner + i;
        int targetBase = o * levelCount * inner + i;
        double sp = surfacePressure[column];
        if (Double.isNaN(sp)) {
          for (int lev = 0; lev < levelCount; lev++) {
            values[targetBase + lev * inner] = Double.NaN;
            pressures[targetBase + lev * inner] = Double.NaN;
          }
          continue;
        }

        int k = levels.aboveGround(sp);
        double[] x = new double[k + 1];
        double[] y = new double[k + 1];
        for (int j = 0; j < k; j++) {
          x[j] = levels.pressures()[j];
          y[j] = source[sourceBase + levels.index()[j] * inner];
        }
        x[k] = sp;
        if (surfaceValues != null) {
          y[k] = surfaceValues[column];
        } else {
          // no surface field: repeat the deepest level above ground
          y[k] = k > 0 ? y[k - 1] : source[sourceBase + levels.index()[0] * inner];
        }

        double[] target = coefficients.pressures(offsetScale, sp);
        double[] result = interpolate(x, y, target, y[0]);
        for (int lev = 0; lev < levelCount; lev++) {
          values[targetBase + lev * inner] = result[lev];
          pressures[targetBase + lev * inner] = target[lev];
        }
      }
    }
  }
}
