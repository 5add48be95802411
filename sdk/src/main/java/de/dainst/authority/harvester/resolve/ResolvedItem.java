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
package de.dainst.authority.harvester.resolve;

import static com.google.common.base.Preconditions.checkArgument;
import static com.google.common.base.Preconditions.checkNotNull;

import com.google.common.base.MoreObjects;
import com.google.common.base.Strings;
import com.google.common.collect.ImmutableList;
import java.time.Instant;
import java.util.Optional;

/**
 * Immutable detail record of one place, name or concept as decoded from its upstream payload.
 *
 * <p>Attributes the assembler does not need, like geometries, are dropped by the payload parsers
 * before an instance is built.
 */
public final class ResolvedItem {
  private final String id;
  private final String localId;
  private final ImmutableList<Label> preferredLabels;
  private final ImmutableList<Label> alternativeLabels;
  private final ImmutableList<Label> definitions;
  private final Optional<String> parentId;
  private final ImmutableList<String> ancestorIds;
  private final ImmutableList<String> narrowerIds;
  private final boolean accessDenied;
  private final boolean topConcept;
  private final Optional<Instant> modified;
  private final Optional<Instant> created;

  private ResolvedItem(Builder builder) {
    this.id = builder.id;
    this.localId = builder.localId;
    this.preferredLabels = builder.preferredLabels.build();
    this.alternativeLabels = builder.alternativeLabels.build();
    this.definitions = builder.definitions.build();
    this.parentId = builder.parentId;
    this.ancestorIds = builder.ancestorIds.build();
    this.narrowerIds = builder.narrowerIds.build();
    this.accessDenied = builder.accessDenied;
    this.topConcept = builder.topConcept;
    this.modified = builder.modified;
    this.created = builder.created;
  }

  /** Globally unique identifier, usually the item URI. */
  public String getId() {
    return id;
  }

  /** Identifier local to the source, e.g. the numeric gazetteer id. */
  public String getLocalId() {
    return localId;
  }

  public ImmutableList<Label> getPreferredLabels() {
    return preferredLabels;
  }

  public ImmutableList<Label> getAlternativeLabels() {
    return alternativeLabels;
  }

  public ImmutableList<Label> getDefinitions() {
    return definitions;
  }

  /** Identifier of the parent or broader item. */
  public Optional<String> getParentId() {
    return parentId;
  }

  /** Identifiers of further ancestors announced by the payload, used for prefetching only. */
  public ImmutableList<String> getAncestorIds() {
    return ancestorIds;
  }

  public ImmutableList<String> getNarrowerIds() {
    return narrowerIds;
  }

  /** Whether the upstream service withholds the details of this item. */
  public boolean isAccessDenied() {
    return accessDenied;
  }

  /** Whether this item is the root of a concept scheme. */
  public boolean isTopConcept() {
    return topConcept;
  }

  public Optional<Instant> getModified() {
    return modified;
  }

  public Optional<Instant> getCreated() {
    return created;
  }

  @Override
  public String toString() {
    return MoreObjects.toStringHelper(this)
        .add("id", id)
        .add("preferredLabels", preferredLabels)
        .add("parentId", parentId.orElse(null))
        .add("accessDenied", accessDenied)
        .omitNullValues()
        .toString();
  }

  /** Builder for {@link ResolvedItem}. */
  public static final class Builder {
    private final String id;
    private String localId;
    private final ImmutableList.Builder<Label> preferredLabels = ImmutableList.builder();
    private final ImmutableList.Builder<Label> alternativeLabels = ImmutableList.builder();
    private final ImmutableList.Builder<Label> definitions = ImmutableList.builder();
    private Optional<String> parentId = Optional.empty();
    private final ImmutableList.Builder<String> ancestorIds = ImmutableList.builder();
    private final ImmutableList.Builder<String> narrowerIds = ImmutableList.builder();
    private boolean accessDenied;
    private boolean topConcept;
    private Optional<Instant> modified = Optional.empty();
    private Optional<Instant> created = Optional.empty();

    public Builder(String id) {
      checkArgument(!Strings.isNullOrEmpty(id), "item id can not be null or empty");
      this.id = id;
      this.localId = id;
    }

    public Builder setLocalId(String localId) {
      this.localId = checkNotNull(localId);
      return this;
    }

    public Builder addPreferredLabel(Label label) {
      preferredLabels.add(label);
      return this;
    }

    public Builder addAlternativeLabel(Label label) {
      alternativeLabels.add(label);
      return this;
    }

    public Builder addDefinition(Label definition) {
      definitions.add(definition);
      return this;
    }

    public Builder setParentId(String parentId) {
      this.parentId = Optional.ofNullable(Strings.emptyToNull(parentId));
      return this;
    }

    public Builder addAncestorId(String ancestorId) {
      ancestorIds.add(ancestorId);
      return this;
    }

    public Builder addNarrowerId(String narrowerId) {
      narrowerIds.add(narrowerId);
      return this;
    }

    public Builder setAccessDenied(boolean accessDenied) {
      this.accessDenied = accessDenied;
      return this;
    }

    public Builder setTopConcept(boolean topConcept) {
      this.topConcept = topConcept;
      return this;
    }

    public Builder setModified(Optional<Instant> modified) {
      this.modified = checkNotNull(modified);
      return this;
    }

    public Builder setCreated(Optional<Instant> created) {
      this.created = checkNotNull(created);
      return this;
    }

    public ResolvedItem build() {
      return new ResolvedItem(this);
    }
  }
}
