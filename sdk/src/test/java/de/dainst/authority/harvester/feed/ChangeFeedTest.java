/*
 * Copyright © 2024 Deutsches Archäologisches Institut
 *
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
package de.dainst.authority.harvester.feed;

import static org.junit.Assert.assertEquals;

import com.google.common.collect.ImmutableList;
import com.google.common.collect.Iterables;
import java.io.IOException;
import java.io.UncheckedIOException;
import java.util.ArrayList;
import java.util.List;
import java.util.Optional;
import org.junit.Rule;
import org.junit.Test;
import org.junit.rules.ExpectedException;

/** Unit tests for {@link ChangeFeed} */
public class ChangeFeedTest {

  @Rule public ExpectedException thrown = ExpectedException.none();

  private abstract static class TestChangeFeed extends ChangeFeed<String, Integer> {
    final List<Optional<Integer>> requestedTokens = new ArrayList<>();

    TestChangeFeed() {
      super(Optional.empty());
    }

    @Override
    protected Page<String, Integer> getPage(Optional<Integer> token) throws IOException {
      requestedTokens.add(token);
      return page(token.orElse(0));
    }

    abstract Page<String, Integer> page(int index) throws IOException;
  }

  @Test
  public void emptyFeed() {
    TestChangeFeed feed =
        new TestChangeFeed() {
          @Override
          Page<String, Integer> page(int index) {
            return Page.last(ImmutableList.of());
          }
        };

    assertEquals(ImmutableList.of(), ImmutableList.copyOf(feed));
    assertEquals(1, feed.requestedTokens.size());
  }

  @Test
  public void multiplePages() {
    TestChangeFeed feed =
        new TestChangeFeed() {
          @Override
          Page<String, Integer> page(int index) {
            switch (index) {
              case 0:
                return Page.withNext(ImmutableList.of("P1", "P2"), 1);
              case 1:
                return Page.withNext(ImmutableList.of("P3"), 2);
              case 2:
                return Page.last(ImmutableList.of());
              default:
                throw new UnsupportedOperationException("Unexpected page " + index);
            }
          }
        };

    assertEquals(
        ImmutableList.of(ImmutableList.of("P1", "P2"), ImmutableList.of("P3")),
        ImmutableList.copyOf(feed));
    assertEquals(ImmutableList.of("P1", "P2", "P3"), ImmutableList.copyOf(feed.entries()));
  }

  @Test
  public void emptyPageInTheMiddle_isSkipped() {
    TestChangeFeed feed =
        new TestChangeFeed() {
          @Override
          Page<String, Integer> page(int index) {
            if (index == 0) {
              return Page.withNext(ImmutableList.of(), 1);
            }
            return Page.last(ImmutableList.of("P1"));
          }
        };

    assertEquals(ImmutableList.of(ImmutableList.of("P1")), ImmutableList.copyOf(feed));
  }

  @Test
  public void pagesAreReadLazily() {
    TestChangeFeed feed =
        new TestChangeFeed() {
          @Override
          Page<String, Integer> page(int index) {
            return Page.withNext(ImmutableList.of("P" + index), index + 1);
          }
        };

    assertEquals(ImmutableList.of("P0", "P1", "P2"),
        ImmutableList.copyOf(Iterables.limit(feed.entries(), 3)));
    assertEquals(3, feed.requestedTokens.size());
  }

  @Test
  public void pageError_surfacesAsUncheckedIOException() {
    TestChangeFeed feed =
        new TestChangeFeed() {
          @Override
          Page<String, Integer> page(int index) throws IOException {
            throw new IOException("feed unavailable");
          }
        };

    thrown.expect(UncheckedIOException.class);
    Iterables.size(feed);
  }

  @Test
  public void startToken_isPassedToFirstRequest() {
    ChangeFeed<String, Integer> feed =
        new ChangeFeed<String, Integer>(Optional.of(7)) {
          @Override
          protected Page<String, Integer> getPage(Optional<Integer> token) {
            return Page.last(ImmutableList.of("page " + token.get()));
          }
        };

    assertEquals(ImmutableList.of("page 7"), ImmutableList.copyOf(feed.entries()));
  }
}
