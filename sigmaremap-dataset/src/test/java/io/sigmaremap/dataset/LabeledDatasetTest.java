package io.sigmaremap.dataset;

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


import io.sigmaremap.units.UnitTable;
import io.sigmaremap.units.UnitsConverter;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;

import java.util.List;
import java.util.Map;

import static org.assertj.core.api.Assertions.*;

@DisplayName("LabeledDataset")
class LabeledDatasetTest {

  private final UnitsConverter converter = new UnitsConverter(UnitTable.defaults());
  private MemoryDataset source;

  @BeforeEach
  void setUp() {
    source = new MemoryDataset("era5");
    source.createCoordinate("level", 3, DataType.INT, Map.of(Attributes.UNITS, "millibars"))
        .setValues(new double[] {100, 500, 900});
    source.createCoordinate("latitude", 2, DataType.FLOAT, Map.of(Attributes.UNITS, "degrees_north"))
        .setValues(new double[] {10, 20});
    source.createCoordinate("height", 2, DataType.FLOAT, Map.of(Attributes.POSITIVE, "Up"))
        .setValues(new double[] {0, 10});
    source.createVariable("t", DataType.SHORT, List.of("level", "latitude"),
            Map.of(Attributes.UNITS, "K", Attributes.FILL_VALUE, (short) -32767,
                Attributes.SCALE_FACTOR, 0.01, Attributes.ADD_OFFSET, 250.0))
        .setValues(new double[] {1, 2, 3, 4, 5, 6});
  }

  @Nested
  @DisplayName("structure")
  class Structure {

    @Test
    void dimensionsKeepDeclarationOrder() {
      assertThat(source.getDimensions()).extracting(Dimension::name)
          .containsExactly("level", "latitude", "height");
    }

    @Test
    void variablesKeepDeclarationOrder() {
      assertThat(source.variableNames()).containsExactly("level", "latitude", "height", "t");
    }

    @Test
    void shapeFollowsDimensions() {
      Variable t = source.getVariable("t");
      assertThat(t.shape()).containsExactly(3, 2);
      assertThat(t.size()).isEqualTo(6);
      assertThat(t.isCoordinate()).isFalse();
      assertThat(source.getVariable("level").isCoordinate()).isTrue();
    }

    @Test
    void duplicateVariableIsRejected() {
      assertThatThrownBy(() -> source.createVariable("t", DataType.FLOAT, List.of("level")))
          .isInstanceOf(DatasetException.class)
          .hasMessageContaining("already has a variable");
    }

    @Test
    void unknownDimensionIsRejected() {
      assertThatThrownBy(() -> source.createVariable("q", DataType.FLOAT, List.of("longitude")))
          .isInstanceOf(DatasetException.class)
          .hasMessageContaining("longitude");
    }

    @Test
    void traversalsAreIndependent() {
      List<Variable> first = source.getVariables();
      first.clear();
      assertThat(source.getVariables()).hasSize(4);
    }

    @Test
    void getOrCreateReportsStatus() {
      assertThat(source.getOrCreateDimension("level", 3, false).status())
          .isEqualTo(LabeledDataset.DimensionStatus.EXISTING);
      assertThat(source.getOrCreateDimension("level", 4, false).status())
          .isEqualTo(LabeledDataset.DimensionStatus.CONFLICT);
      assertThat(source.getDimension("level").size()).isEqualTo(3);
      assertThat(source.getOrCreateDimension("time", 1, true).status())
          .isEqualTo(LabeledDataset.DimensionStatus.CREATED);
    }
  }

  @Nested
  @DisplayName("copying")
  class Copying {

    @Test
    @DisplayName("copying a variable brings its dimensions and coordinates along")
    void copyBringsCoordinates() {
      MemoryDataset target = new MemoryDataset("out");
      target.copyVariable(source.getVariable("t"), source);

      assertThat(target.variableNames()).containsExactly("level", "latitude", "t");
      assertThat(target.getVariable("level").getValues()).containsExactly(100, 500, 900);
      assertThat(target.getVariable("t").getValues()).containsExactly(1, 2, 3, 4, 5, 6);
      assertThat(target.getVariable("t").getAttributes())
          .containsEntry(Attributes.UNITS, "K")
          .containsEntry(Attributes.SCALE_FACTOR, 0.01);
      assertThat(target.getVariable("t").attributeNames()).first().isEqualTo(Attributes.FILL_VALUE);
    }

    @Test
    void copyDimensionIsIdempotent() {
      MemoryDataset target = new MemoryDataset("out");
      Dimension level = source.getDimension("level");
      target.copyDimension(level);
      target.copyDimension(level);
      assertThat(target.getDimensions()).containsExactly(level);
    }

    @Test
    void copyDimensionConflict() {
      MemoryDataset target = new MemoryDataset("out");
      target.createDimension("level", 5);
      assertThatThrownBy(() -> target.copyDimension(source.getDimension("level")))
          .isInstanceOfSatisfying(DimensionConflictException.class, e -> {
            assertThat(e.getDimension()).isEqualTo("level");
            assertThat(e.getExistingSize()).isEqualTo(5);
            assertThat(e.getRequestedSize()).isEqualTo(3);
          });
    }

    @Test
    void existingDimensionKeepsItsCoordinate() {
      MemoryDataset target = new MemoryDataset("out");
      target.createDimension("latitude", 2);
      target.copyVariable(source.getVariable("t"), source);
      assertThat(target.hasVariable("latitude")).isFalse();
      assertThat(target.hasVariable("level")).isTrue();
    }

    @Test
    void copyAttributeRequiresSourceAttribute() {
      MemoryDataset target = new MemoryDataset("out");
      target.copyVariable(source.getVariable("level"), source);
      assertThatThrownBy(() -> target.copyAttribute(source.getVariable("level"), "long_name"))
          .isInstanceOf(DatasetException.class);
    }
  }

  @Nested
  @DisplayName("coordinate classification")
  class Classification {

    @Test
    void pressureCoordinatesByUnits() {
      assertThat(source.pressureCoordinates(converter)).extracting(Variable::getName)
          .containsExactly("level");
    }

    @Test
    void verticalCoordinatesIncludePositive() {
      assertThat(source.verticalCoordinates(converter)).extracting(Variable::getName)
          .containsExactly("level", "height");
    }

    @Test
    void verticalCoordinatesAppearOnce() {
      source.getVariable("level").setAttribute(Attributes.AXIS, "Z");
      source.getVariable("level").setAttribute(Attributes.POSITIVE, "down");
      assertThat(source.verticalCoordinates(converter)).extracting(Variable::getName)
          .containsExactly("level", "height");
    }

    @Test
    void dimensionVariablesFollowDimensionOrder() {
      assertThat(source.dimensionVariables()).extracting(Variable::getName)
          .containsExactly("level", "latitude", "height");
    }
  }

  @Nested
  @DisplayName("access mode")
  class Access {

    @Test
    void frozenDatasetRejectsChanges() {
      source.freeze();
      assertThat(source.isWritable()).isFalse();
      assertThatThrownBy(() -> source.createDimension("time", 1))
          .isInstanceOf(DatasetException.class).hasMessageContaining("read-only");
      assertThatThrownBy(() -> source.getVariable("t").setAttribute("x", "y"))
          .isInstanceOf(DatasetException.class);
      assertThatThrownBy(() -> source.getVariable("t").set(0, 1))
          .isInstanceOf(DatasetException.class);
    }

    @Test
    void closedDatasetRejectsChanges() {
      source.close();
      source.close();
      assertThat(source.isClosed()).isTrue();
      assertThatThrownBy(() -> source.createDimension("time", 1))
          .isInstanceOf(DatasetException.class).hasMessageContaining("closed");
    }
  }

  @Nested
  @DisplayName("unlimited dimensions")
  class Unlimited {

    @Test
    void growingExtendsDependentVariables() {
      MemoryDataset dataset = new MemoryDataset("series");
      dataset.createUnlimitedDimension("time", 1);
      dataset.createDimension("x", 2);
      Variable sp = dataset.createVariable("sp", DataType.DOUBLE, List.of("time", "x"));
      sp.setValues(new double[] {1, 2});

      dataset.growDimension("time", 3);

      assertThat(sp.size()).isEqualTo(6);
      assertThat(sp.getValues()).containsExactly(1, 2, 0, 0, 0, 0);
    }

    @Test
    void fixedDimensionCannotGrow() {
      assertThatThrownBy(() -> source.growDimension("level", 4))
          .isInstanceOf(DatasetException.class).hasMessageContaining("not unlimited");
    }

    @Test
    void innerUnlimitedAxisCannotGrow() {
      MemoryDataset dataset = new MemoryDataset("series");
      dataset.createDimension("x", 2);
      dataset.createUnlimitedDimension("time", 1);
      dataset.createVariable("sp", DataType.DOUBLE, List.of("x", "time"));
      assertThatThrownBy(() -> dataset.growDimension("time", 2))
          .isInstanceOf(DatasetException.class).hasMessageContaining("inner axis");
    }
  }
}
