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

import static com.google.common.base.Preconditions.checkNotNull;

import com.google.common.collect.ImmutableList;
import com.google.common.collect.Iterables;
import java.io.IOException;
import java.io.UncheckedIOException;
import java.util.Iterator;
import java.util.List;
import java.util.NoSuchElementException;
import java.util.Optional;

/**
 * Lazily walks a paged change feed, one page per batch.
 *
 * <p>Iteration yields the non-empty pages in feed order and requests the next page only when
 * the previous one has been consumed. Each call to {@link #iterator()} restarts from the start
 * token. A page that can not be read ends the iteration with an {@link UncheckedIOException}
 * wrapping the original failure.
 *
 * @param <T> feed entry type
 * @param <Q> continuation token type: an offset, a page index or a scroll cursor
 */
public abstract class ChangeFeed<T, Q> implements Iterable<List<T>> {

  private final Optional<Q> startToken;

  /** Entries of one page plus the token of the following page, if there is one. */
  public static final class Page<T, Q> {
    private final List<T> results;
    private final Optional<Q> nextPageToken;

    public Page(List<T> results, Optional<Q> nextPageToken) {
      this.results = ImmutableList.copyOf(checkNotNull(results));
      this.nextPageToken = checkNotNull(nextPageToken);
    }

    /** Page followed by the page identified by {@code nextPageToken}. */
    public static <T, Q> Page<T, Q> withNext(List<T> results, Q nextPageToken) {
      return new Page<>(results, Optional.of(nextPageToken));
    }

    /** Final page of the feed. */
    public static <T, Q> Page<T, Q> last(List<T> results) {
      return new Page<>(results, Optional.empty());
    }

    public List<T> getResults() {
      return results;
    }

    public Optional<Q> getNextPageToken() {
      return nextPageToken;
    }
  }

  /**
   * @param startToken token of the first page, empty when the first request carries none
   */
  protected ChangeFeed(Optional<Q> startToken) {
    this.startToken = checkNotNull(startToken);
  }

  /**
   * Reads one page.
   *
   * @param token token returned with the previous page, or the start token
   * @throws IOException if the page can not be read
   */
  protected abstract Page<T, Q> getPage(Optional<Q> token) throws IOException;

  /** Flattened view over all entries of all pages. */
  public Iterable<T> entries() {
    return Iterables.concat(this);
  }

  @Override
  public Iterator<List<T>> iterator() {
    return new PageIterator();
  }

  private class PageIterator implements Iterator<List<T>> {
    private Optional<Q> nextToken = startToken;
    private boolean firstPageRequested;
    private List<T> pending = ImmutableList.of();

    @Override
    public boolean hasNext() {
      while (pending.isEmpty() && (!firstPageRequested || nextToken.isPresent())) {
        Page<T, Q> page = fetch(nextToken);
        firstPageRequested = true;
        pending = page.results;
        nextToken = page.nextPageToken;
      }
      return !pending.isEmpty();
    }

    @Override
    public List<T> next() {
      if (!hasNext()) {
        throw new NoSuchElementException();
      }
      List<T> results = pending;
      pending = ImmutableList.of();
      return results;
    }

    private Page<T, Q> fetch(Optional<Q> token) {
      try {
        return checkNotNull(getPage(token), "feed returned no page");
      } catch (IOException e) {
        throw new UncheckedIOException("Error reading change feed page " + token, e);
      }
    }
  }
}
