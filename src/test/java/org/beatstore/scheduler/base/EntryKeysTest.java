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
package org.beatstore.scheduler.base;

import java.util.Arrays;
import java.util.LinkedHashMap;
import java.util.Map;

import com.google.common.collect.ImmutableList;
import com.google.common.collect.ImmutableMap;

import org.junit.Test;

import static org.junit.Assert.assertEquals;
import static org.junit.Assert.assertFalse;

public class EntryKeysTest {

  @Test
  public void testScalarArguments() {
    assertEquals(
        "send_email-a@x.com-2-urgent-True",
        EntryKeys.compute(
            "send_email",
            ImmutableList.of("a@x.com", 2L),
            ImmutableMap.of("urgent", true)));
  }

  @Test
  public void testNoArguments() {
    assertEquals("cleanup", EntryKeys.compute("cleanup", ImmutableList.of(), ImmutableMap.of()));
  }

  @Test
  public void testKeywordsOnly() {
    assertEquals(
        "report--region-eu-limit-10",
        EntryKeys.compute(
            "report",
            ImmutableList.of(),
            ImmutableMap.of("region", "eu", "limit", 10L)));
  }

  @Test
  public void testNullAndFalse() {
    assertEquals(
        "task-None-flag-False",
        EntryKeys.compute("task", Arrays.asList((Object) null), ImmutableMap.of("flag", false)));
  }

  @Test
  public void testNestedValuesAreFlattened() {
    String key = EntryKeys.compute(
        "sync",
        ImmutableList.of(ImmutableList.of("a", "b"), ImmutableMap.of("k", "v")),
        ImmutableMap.of("opts", ImmutableMap.of("dry", true)));
    assertEquals("sync-ab-k:v-opts-dry:True", key);
    for (char c : "[](){}, '\"".toCharArray()) {
      assertFalse(key.indexOf(c) >= 0);
    }
  }

  @Test
  public void testDoublesRenderLikeKeysWrittenByOtherSchedulers() {
    assertEquals("1.5", EntryKeys.reprDouble(1.5));
    assertEquals("100.0", EntryKeys.reprDouble(100.0));
    assertEquals("0.0001", EntryKeys.reprDouble(1e-4));
    assertEquals("1e-05", EntryKeys.reprDouble(1e-5));
    assertEquals("1.5e-07", EntryKeys.reprDouble(1.5e-7));
    assertEquals("1e+16", EntryKeys.reprDouble(1e16));
    assertEquals("1234567890123456.0", EntryKeys.reprDouble(1234567890123456.0));
    assertEquals("-2.5e+20", EntryKeys.reprDouble(-2.5e20));
    assertEquals("-0.0", EntryKeys.reprDouble(-0.0));
    assertEquals(
        "measure-1e+16-1e-05",
        EntryKeys.compute("measure", ImmutableList.of(1e16, 1e-5), ImmutableMap.of()));
  }

  @Test
  public void testDeterministic() {
    Map<String, Object> first = new LinkedHashMap<>();
    first.put("a", 1L);
    first.put("b", "two");
    Map<String, Object> second = new LinkedHashMap<>(first);

    assertEquals(
        EntryKeys.compute("t", ImmutableList.of(1L, "x"), first),
        EntryKeys.compute("t", ImmutableList.of(1L, "x"), second));
  }

  @Test
  public void testKeywordOrderMatters() {
    assertEquals(
        "t--a-1-b-2",
        EntryKeys.compute("t", ImmutableList.of(), ImmutableMap.of("a", 1L, "b", 2L)));
    assertEquals(
        "t--b-2-a-1",
        EntryKeys.compute("t", ImmutableList.of(), ImmutableMap.of("b", 2L, "a", 1L)));
  }
}
