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
package de.dainst.authority.harvester;

import static com.google.common.base.Preconditions.checkNotNull;

import com.google.api.client.http.HttpTransport;
import de.dainst.authority.harvester.feed.SinceFilter;
import de.dainst.authority.harvester.record.RecordSink;
import java.time.LocalDate;
import java.util.Optional;

/** Parameters and shared resources of one harvester run. */
public final class HarvestContext {
  private final Optional<LocalDate> sinceDate;
  private final LocalDate today;
  private final HttpTransport transport;
  private final RecordSink sink;

  private HarvestContext(Builder builder) {
    this.sinceDate = builder.sinceDate;
    this.today = builder.today;
    this.transport = builder.transport;
    this.sink = builder.sink;
  }

  /** First day of the harvest window; empty for a full harvest. */
  public Optional<LocalDate> getSinceDate() {
    return sinceDate;
  }

  public SinceFilter getSinceFilter() {
    return SinceFilter.of(sinceDate);
  }

  /** Day the run started. */
  public LocalDate getToday() {
    return today;
  }

  public HttpTransport getTransport() {
    return transport;
  }

  public RecordSink getSink() {
    return sink;
  }

  /** Builder for {@link HarvestContext}. */
  public static final class Builder {
    private Optional<LocalDate> sinceDate = Optional.empty();
    private LocalDate today;
    private HttpTransport transport;
    private RecordSink sink;

    public Builder setSinceDate(Optional<LocalDate> sinceDate) {
      this.sinceDate = checkNotNull(sinceDate);
      return this;
    }

    public Builder setToday(LocalDate today) {
      this.today = today;
      return this;
    }

    public Builder setTransport(HttpTransport transport) {
      this.transport = transport;
      return this;
    }

    public Builder setSink(RecordSink sink) {
      this.sink = sink;
      return this;
    }

    public HarvestContext build() {
      checkNotNull(today, "today can not be null");
      checkNotNull(transport, "transport can not be null");
      checkNotNull(sink, "sink can not be null");
      return new HarvestContext(this);
    }
  }
}
