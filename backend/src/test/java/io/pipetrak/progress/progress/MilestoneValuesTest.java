package io.pipetrak.progress.progress;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

import io.pipetrak.progress.exception.InvalidStateException;
import io.pipetrak.progress.template.CompletionKind;
import java.math.BigDecimal;
import java.util.LinkedHashMap;
import org.junit.jupiter.api.Test;

class MilestoneValuesTest {

  @Test
  void discreteAcceptsBooleansOnesAndHundreds() {
    assertThat(MilestoneValues.normalize(true, CompletionKind.DISCRETE))
        .isEqualByComparingTo("100");
    assertThat(MilestoneValues.normalize(false, CompletionKind.DISCRETE))
        .isEqualByComparingTo("0");
    assertThat(MilestoneValues.normalize(1, CompletionKind.DISCRETE)).isEqualByComparingTo("100");
    assertThat(MilestoneValues.normalize(100, CompletionKind.DISCRETE))
        .isEqualByComparingTo("100");
    assertThat(MilestoneValues.normalize("TRUE", CompletionKind.DISCRETE))
        .isEqualByComparingTo("100");
    assertThat(MilestoneValues.normalize(0, CompletionKind.DISCRETE)).isEqualByComparingTo("0");
  }

  @Test
  void discreteRejectsIntermediateValues() {
    assertThatThrownBy(() -> MilestoneValues.normalize(50, CompletionKind.DISCRETE))
        .isInstanceOf(InvalidStateException.class);
  }

  @Test
  void partialAcceptsRangeAndRejectsOutside() {
    assertThat(MilestoneValues.normalize(new BigDecimal("37.5"), CompletionKind.PARTIAL))
        .isEqualByComparingTo("37.5");
    assertThat(MilestoneValues.normalize("80", CompletionKind.PARTIAL)).isEqualByComparingTo("80");
    assertThatThrownBy(() -> MilestoneValues.normalize(-1, CompletionKind.PARTIAL))
        .isInstanceOf(InvalidStateException.class);
    assertThatThrownBy(() -> MilestoneValues.normalize(100.5, CompletionKind.PARTIAL))
        .isInstanceOf(InvalidStateException.class);
  }

  @Test
  void partialIsRoundedToStoredScale() {
    assertThat(MilestoneValues.normalize(new BigDecimal("33.333333"), CompletionKind.PARTIAL))
        .isEqualTo(new BigDecimal("33.3333"));
  }

  @Test
  void nullAndNonNumericAreRejected() {
    assertThatThrownBy(() -> MilestoneValues.normalize(null, CompletionKind.PARTIAL))
        .isInstanceOf(InvalidStateException.class);
    assertThatThrownBy(() -> MilestoneValues.normalize("done", CompletionKind.DISCRETE))
        .isInstanceOf(InvalidStateException.class);
  }

  @Test
  void storedLegacyBooleansReadAsPercent() {
    var stored = new LinkedHashMap<String, Object>();
    stored.put("Receive", true);
    stored.put("Erect", false);
    stored.put("Fabricate", 42.5);
    stored.put("Connect", null);

    var values = MilestoneValues.fromStoredMap(stored);

    assertThat(values.get("Receive")).isEqualByComparingTo("100");
    assertThat(values.get("Erect")).isEqualByComparingTo("0");
    assertThat(values.get("Fabricate")).isEqualByComparingTo("42.5");
    assertThat(values.get("Connect")).isEqualByComparingTo("0");
  }
}
