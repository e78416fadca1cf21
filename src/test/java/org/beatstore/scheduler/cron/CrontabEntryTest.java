/**
 * Licensed under the Apache License, Version 2.0 (the "License");
 * you may not use this file except in compliance with the License.
 * You may obtain a copy of the License at
 *
 *     http://www.apache.org/licenses/LICENSE-2.0
 *
 * Unless required by applicable law or agreed to in writing, software
 * distributed under the License is distributed on an "AS IS" BASIS,
 * WITHOUT WARRANTIES OR CONDITIONS OF ANY KIND, either express or implied.
 * See the License for the specific language governing permissions and
 * limitations under the License.
 */
package org.beatstore.scheduler.cron;

import java.time.LocalDateTime;
import java.util.List;
import java.util.Optional;
import java.util.Set;

import com.google.common.collect.ImmutableList;
import com.google.common.collect.Sets;

import org.beatstore.scheduler.base.InvalidScheduleException;
import org.junit.Test;

import static org.junit.Assert.assertEquals;
import static org.junit.Assert.assertFalse;
import static org.junit.Assert.assertNotEquals;
import static org.junit.Assert.assertTrue;

public class CrontabEntryTest {
  @Test
  public void testHashCodeAndEquals() {
    List<CrontabEntry> entries = ImmutableList.of(
        CrontabEntry.parse("* * * * *"),
        CrontabEntry.parse("0-59 * * * *"),
        CrontabEntry.parse("0-57,58,59 * * * *"),
        CrontabEntry.parse("* 23,1,2,4,0-22 * * *"),
        CrontabEntry.parse("1-50,0,51-59 * * * sun-sat"));

    for (CrontabEntry lhs : entries) {
      for (CrontabEntry rhs : entries) {
        assertEquals(lhs, rhs);
      }
    }

    Set<CrontabEntry> equivalentEntries = Sets.newHashSet(entries);
    assertEquals(1, equivalentEntries.size());
  }

  @Test
  public void testEqualsCoverage() {
    assertNotEquals(CrontabEntry.parse("* * * * *"), new Object());

    assertNotEquals(CrontabEntry.parse("* * * * *"), CrontabEntry.parse("1 * * * *"));
    assertEquals(CrontabEntry.parse("1,2,3 * * * *"), CrontabEntry.parse("1-3 * * * *"));

    assertNotEquals(CrontabEntry.parse("* 0-22 * * *"), CrontabEntry.parse("* * * * *"));
    assertEquals(CrontabEntry.parse("* 0-23 * * *"), CrontabEntry.parse("* * * * *"));

    assertNotEquals(CrontabEntry.parse("1 1 1-30 * *"), CrontabEntry.parse("1 1 * * *"));
    assertEquals(CrontabEntry.parse("1 1 1-31 * *"), CrontabEntry.parse("1 1 * * *"));

    assertNotEquals(CrontabEntry.parse("1 1 * JAN,FEB-NOV *"), CrontabEntry.parse("1 1 * * *"));
    assertEquals(CrontabEntry.parse("1 1 * JAN,FEB-DEC *"), CrontabEntry.parse("1 1 * * *"));

    assertNotEquals(CrontabEntry.parse("* * * * SUN"), CrontabEntry.parse("* * * * SAT"));
    assertEquals(CrontabEntry.parse("* * * * 0"), CrontabEntry.parse("* * * * SUN"));
  }

  @Test
  public void testSkip() {
    assertEquals(CrontabEntry.parse("*/15 * * * *"), CrontabEntry.parse("0,15,30,45 * * * *"));
    assertEquals(
        CrontabEntry.parse("* */2 * * *"),
        CrontabEntry.parse("0-59 0,2,4,6,8,10,12-23/2  * * *"));
  }

  @Test
  public void testSkipWiderThanRange() {
    assertEquals(CrontabEntry.parse("0 * * * *"), CrontabEntry.parse("0-30/30 * * * *"));
    assertEquals(CrontabEntry.parse("0,30 * * * *"), CrontabEntry.parse("0-59/30 * * * *"));
    assertEquals(CrontabEntry.parse("0 0 * * *"), CrontabEntry.parse("0 0-23/23 * * *"));
    assertEquals(CrontabEntry.parse("0 * * * *"), CrontabEntry.parse("0-59/60 * * * *"));
  }

  @Test
  public void testToString() {
    assertEquals("0-58 * * * *", CrontabEntry.parse("0,1-57,58 * * * *").toString());
    assertEquals("* * * * *", CrontabEntry.parse("* * * * *").toString());
  }

  @Test
  public void testWildcards() {
    CrontabEntry wildcardMinuteEntry = CrontabEntry.parse("* 1 1 1 *");
    assertEquals("*", wildcardMinuteEntry.getMinuteAsString());
    assertTrue(wildcardMinuteEntry.hasWildcardMinute());
    assertFalse(wildcardMinuteEntry.hasWildcardHour());
    assertFalse(wildcardMinuteEntry.hasWildcardDayOfMonth());
    assertFalse(wildcardMinuteEntry.hasWildcardMonth());
    assertTrue(wildcardMinuteEntry.hasWildcardDayOfWeek());

    CrontabEntry wildcardMonth = CrontabEntry.parse("1 1 1 * *");
    assertEquals("*", wildcardMonth.getMonthAsString());
    assertFalse(wildcardMonth.hasWildcardMinute());
    assertFalse(wildcardMonth.hasWildcardHour());
    assertFalse(wildcardMonth.hasWildcardDayOfMonth());
    assertTrue(wildcardMonth.hasWildcardMonth());
    assertTrue(wildcardMonth.hasWildcardDayOfWeek());

    CrontabEntry wildcardDayOfWeek = CrontabEntry.parse("1 1 1 1 *");
    assertEquals("*", wildcardDayOfWeek.getDayOfWeekAsString());
    assertTrue(wildcardDayOfWeek.hasWildcardDayOfWeek());
  }

  @Test
  public void testEqualsIsCanonical() {
    String rawEntry = "* * */3 * *";
    CrontabEntry input = CrontabEntry.parse(rawEntry);
    assertNotEquals(
        rawEntry + " is not the canonical form of " + input,
        rawEntry,
        input.toString());
    assertEquals(
        "The form returned by toString is canonical",
        input.toString(),
        CrontabEntry.parse(input.toString()).toString());
  }

  @Test
  public void testBadEntries() {
    List<String> badPatterns = ImmutableList.of(
        "* * * * MON-SUN",
        "* * **",
        "0-59 0-59 * * *",
        "1/1 * * * *",
        "5 5 * MAR-JAN *",
        "*/0 * * * *",
        "0-59/0 * * * *",
        "* * * * 7",
        "not a schedule",
        ""
    );

    for (String pattern : badPatterns) {
      assertEquals(pattern, Optional.empty(), CrontabEntry.tryParse(pattern));
    }
  }

  @Test(expected = InvalidScheduleException.class)
  public void testParseRejects() {
    CrontabEntry.parse("61 * * * *");
  }

  @Test
  public void testBothDayFieldsAreOred() {
    // The 1st of the month or any Monday.
    CrontabEntry entry = CrontabEntry.parse("0 0 1 * 1");
    assertTrue(entry.matches(LocalDateTime.parse("2024-02-01T00:00")));
    assertTrue(entry.matches(LocalDateTime.parse("2024-02-05T00:00")));
    assertFalse(entry.matches(LocalDateTime.parse("2024-02-06T00:00")));
  }

  @Test
  public void testSingleRestrictedDayField() {
    CrontabEntry mondays = CrontabEntry.parse("0 0 * * MON");
    assertTrue(mondays.matches(LocalDateTime.parse("2024-02-05T00:00")));
    assertFalse(mondays.matches(LocalDateTime.parse("2024-02-01T00:00")));

    CrontabEntry firsts = CrontabEntry.parse("0 0 1 * *");
    assertTrue(firsts.matches(LocalDateTime.parse("2024-02-01T00:00")));
    assertFalse(firsts.matches(LocalDateTime.parse("2024-02-05T00:00")));
  }

  @Test
  public void testMatchesIgnoresSeconds() {
    CrontabEntry entry = CrontabEntry.parse("30 12 * * *");
    assertTrue(entry.matches(LocalDateTime.parse("2024-02-01T12:30:59")));
    assertFalse(entry.matches(LocalDateTime.parse("2024-02-01T12:31:00")));
  }

  @Test
  public void testNextMatch() {
    CrontabEntry entry = CrontabEntry.parse("*/15 9-17 * * MON-FRI");
    assertEquals(
        Optional.of(LocalDateTime.parse("2024-01-08T09:00")),
        entry.nextMatchAtOrAfter(LocalDateTime.parse("2024-01-05T17:45:01")));
    assertEquals(
        Optional.of(LocalDateTime.parse("2024-01-05T17:45")),
        entry.nextMatchAtOrAfter(LocalDateTime.parse("2024-01-05T17:45")));
    assertEquals(
        Optional.of(LocalDateTime.parse("2024-01-05T10:15")),
        entry.nextMatchAtOrAfter(LocalDateTime.parse("2024-01-05T10:00:30")));
  }

  @Test
  public void testNextMatchAcrossYears() {
    assertEquals(
        Optional.of(LocalDateTime.parse("2028-02-29T00:00")),
        CrontabEntry.parse("0 0 29 2 *")
            .nextMatchAtOrAfter(LocalDateTime.parse("2024-03-01T00:00")));
  }

  @Test
  public void testNeverFires() {
    CrontabEntry entry = CrontabEntry.parse("0 0 31 2 *");
    assertEquals(
        Optional.empty(),
        entry.nextMatchAtOrAfter(LocalDateTime.parse("2024-01-01T00:00")));
  }
}
