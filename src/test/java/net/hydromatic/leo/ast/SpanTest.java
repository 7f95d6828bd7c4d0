/*
 * Licensed to Julian Hyde under one or more contributor license
 * agreements.  See the NOTICE file distributed with this work
 * for additional information regarding copyright ownership.
 * Julian Hyde licenses this file to you under the Apache
 * License, Version 2.0 (the "License"); you may not use this
 * file except in compliance with the License.  You may obtain a
 * copy of the License at
 *
 * http://www.apache.org/licenses/LICENSE-2.0
 *
 * Unless required by applicable law or agreed to in writing,
 * software distributed under the License is distributed on an
 * "AS IS" BASIS, WITHOUT WARRANTIES OR CONDITIONS OF ANY KIND,
 * either express or implied.  See the License for the specific
 * language governing permissions and limitations under the
 * License.
 */
package net.hydromatic.leo.ast;

import static org.hamcrest.CoreMatchers.is;
import static org.hamcrest.MatcherAssert.assertThat;
import static org.hamcrest.Matchers.hasToString;
import static org.hamcrest.Matchers.not;
import static org.junit.jupiter.api.Assertions.assertThrows;

import com.google.common.collect.ImmutableList;
import org.junit.jupiter.api.Test;

/** Unit test for {@link Span}. */
class SpanTest {
  @Test void testToString() {
    assertThat(Span.of(3, 5, 5), hasToString("3.5"));
    assertThat(Span.of(3, 5, 9), hasToString("3.5-3.9"));
    assertThat(new Span("a.leo", 1, 2, 4, 1), hasToString("a.leo:1.2-4.1"));
    assertThat(Span.ZERO, hasToString("0.0"));
  }

  @Test void testOffsets() {
    final String source = "let x = 1;\nlet y = x;\n";
    final Span span = Span.of(source, "f.leo", 15, 20);
    assertThat(span.startLine, is(2));
    assertThat(span.startColumn, is(5));
    assertThat(span.endLine, is(2));
    assertThat(span.endColumn, is(10));
    assertThat(span, hasToString("f.leo:2.5-2.10"));

    assertThat(Span.of(source, "", 0, 0), hasToString("1.1"));
    assertThrows(IllegalArgumentException.class,
        () -> Span.of(source, "", 0, 100));
  }

  @Test void testEqualsIgnoresFile() {
    final Span a = new Span("a.leo", 1, 2, 3, 4);
    final Span b = new Span("b.leo", 1, 2, 3, 4);
    assertThat(a, is(b));
    assertThat(a.hashCode(), is(b.hashCode()));
    assertThat(a, not(is(Span.of(1, 2, 4))));
  }

  @Test void testPlus() {
    final Span a = Span.of(1, 5, 7);
    final Span b = Span.of(2, 1, 3);
    assertThat(a.plus(b), hasToString("1.5-2.3"));
    assertThat(b.plus(a), hasToString("1.5-2.3"));
    assertThat(a.plus(Span.ZERO), is(a));
    assertThat(Span.ZERO.plus(a), is(a));

    // one span inside another
    assertThat(Span.of(1, 1, 10).plus(Span.of(1, 3, 4)),
        hasToString("1.1-1.10"));
  }

  @Test void testSum() {
    assertThat(Span.sum(ImmutableList.of()), is(Span.ZERO));
    assertThat(
        Span.sum(
            ImmutableList.of(Span.of(2, 4, 4), Span.ZERO, Span.of(1, 8, 9))),
        hasToString("1.8-2.4"));
  }
}

// End SpanTest.java
