package ca.gc.cra.logmerge.domain.dedup;

import static ca.gc.cra.logmerge.testutil.Qsos.qso;
import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertInstanceOf;
import static org.junit.jupiter.api.Assertions.assertSame;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;

import ca.gc.cra.logmerge.domain.adif.AdifRecord;
import ca.gc.cra.logmerge.domain.adif.AdifTags;
import java.time.Duration;
import java.util.List;
import java.util.Map;
import org.junit.jupiter.api.Test;

class DuplicateIndexTest {
  private static final String GROUP = "W1AW-FN31";

  @Test
  void contactTenMinutesLaterIsDuplicateOfFirst() {
    DuplicateIndex index = new DuplicateIndex();
    AdifRecord first = qso("a.adi", "W1AW", "FN31", "K1ABC", "20240101", "120000");
    AdifRecord second = qso("b.adi", "W1AW", "FN31", "K1ABC", "20240101", "121000");

    assertTrue(index.process(first, GROUP).isAccepted());
    Outcome outcome = index.process(second, GROUP);

    Outcome.Duplicate duplicate = assertInstanceOf(Outcome.Duplicate.class, outcome);
    assertSame(first, duplicate.existing());
    assertEquals(List.of(first), index.groups().get(GROUP));
    assertEquals(1, index.acceptedCount());
    assertEquals(1, index.duplicateCount());
  }

  @Test
  void toleranceBoundaryIsInclusive() {
    DuplicateIndex index = new DuplicateIndex();
    index.process(qso("a", "W1AW", "FN31", "K1ABC", "20240101", "120000"), GROUP);

    Outcome atLimit = index.process(qso("b", "W1AW", "FN31", "K1ABC", "20240101", "121500"), GROUP);
    Outcome pastLimit = index.process(qso("c", "W1AW", "FN31", "K1ABC", "20240101", "114459"), GROUP);

    assertInstanceOf(Outcome.Duplicate.class, atLimit);
    assertTrue(pastLimit.isAccepted());
  }

  @Test
  void nineHundredOneSecondsApartAreBothAccepted() {
    DuplicateIndex index = new DuplicateIndex();

    assertTrue(index.process(qso("a", "W1AW", "FN31", "K1ABC", "20240101", "120000"), GROUP).isAccepted());
    assertTrue(index.process(qso("a", "W1AW", "FN31", "K1ABC", "20240101", "121501"), GROUP).isAccepted());
    assertEquals(2, index.groups().get(GROUP).size());
  }

  @Test
  void groupsAreIsolated() {
    DuplicateIndex index = new DuplicateIndex();

    index.process(qso("a", "W1AW", "FN31", "K1ABC", "20240101", "120000"), "W1AW-FN31");
    Outcome other = index.process(qso("b", "W1AW", "FN42", "K1ABC", "20240101", "120000"), "W1AW-FN42");

    assertTrue(other.isAccepted());
    assertEquals(List.of("W1AW-FN31", "W1AW-FN42"), List.copyOf(index.groups().keySet()));
  }

  @Test
  void differentBandOrModeIsNotDuplicate() {
    DuplicateIndex index = new DuplicateIndex();
    index.process(qso("a", "W1AW", "FN31", "K1ABC", "20240101", "120000"), GROUP);
    AdifRecord otherBand = AdifRecord.builder("b")
        .put(AdifTags.CALL, "K1ABC").put(AdifTags.BAND, "40M").put(AdifTags.MODE, "SSB")
        .put(AdifTags.QSO_DATE, "20240101").put(AdifTags.TIME_ON, "120000").build();

    assertTrue(index.process(otherBand, GROUP).isAccepted());
  }

  @Test
  void recordsWithoutTimeOrCallsignAreAlwaysAccepted() {
    DuplicateIndex index = new DuplicateIndex();
    AdifRecord noTime = AdifRecord.of("a", Map.of(AdifTags.CALL, "K1ABC", AdifTags.BAND, "20M"));
    AdifRecord noCall = AdifRecord.of("a", Map.of(
        AdifTags.BAND, "20M", AdifTags.QSO_DATE, "20240101", AdifTags.TIME_ON, "1200"));

    for (int i = 0; i < 3; i++) {
      assertTrue(index.process(noTime, GROUP).isAccepted());
      assertTrue(index.process(noCall, GROUP).isAccepted());
    }
    assertEquals(6, index.acceptedCount());
    assertEquals(0, index.duplicateCount());
  }

  @Test
  void matchesEarliestAcceptedCandidateInOrder() {
    DuplicateIndex index = new DuplicateIndex(Duration.ofMinutes(10));
    AdifRecord first = qso("a", "W1AW", "FN31", "K1ABC", "20240101", "120000");
    AdifRecord second = qso("a", "W1AW", "FN31", "K1ABC", "20240101", "121500");
    index.process(first, GROUP);
    index.process(second, GROUP);

    Outcome between = index.process(qso("b", "W1AW", "FN31", "K1ABC", "20240101", "120800"), GROUP);

    assertSame(first, assertInstanceOf(Outcome.Duplicate.class, between).existing());
  }

  @Test
  void zeroToleranceOnlyMatchesSameSecond() {
    DuplicateIndex index = new DuplicateIndex(Duration.ZERO);
    index.process(qso("a", "W1AW", "FN31", "K1ABC", "20240101", "120000"), GROUP);

    assertInstanceOf(Outcome.Duplicate.class,
        index.process(qso("b", "W1AW", "FN31", "k1abc", "20240101", "1200"), GROUP));
    assertTrue(index.process(qso("b", "W1AW", "FN31", "K1ABC", "20240101", "120001"), GROUP).isAccepted());
  }

  @Test
  void rejectsNegativeTolerance() {
    assertThrows(IllegalArgumentException.class, () -> new DuplicateIndex(Duration.ofSeconds(-1)));
    assertEquals(DuplicateIndex.DEFAULT_TOLERANCE, new DuplicateIndex().tolerance());
  }

  @Test
  void groupViewsAreReadOnly() {
    DuplicateIndex index = new DuplicateIndex();
    index.process(qso("a", "W1AW", "FN31", "K1ABC", "20240101", "120000"), GROUP);

    assertThrows(UnsupportedOperationException.class, () -> index.groups().get(GROUP).clear());
    assertFalse(index.groups().containsKey("missing"));
  }
}
