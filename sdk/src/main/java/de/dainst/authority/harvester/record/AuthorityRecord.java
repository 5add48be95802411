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
package de.dainst.authority.harvester.record;

import static com.google.common.base.Preconditions.checkArgument;
import static com.google.common.base.Preconditions.checkNotNull;

import com.google.common.base.MoreObjects;
import com.google.common.collect.ImmutableList;
import de.dainst.authority.harvester.resolve.Label;
import java.util.List;
import java.util.Optional;

/** Logical authority record, independent of its MARC encoding. */
public final class AuthorityRecord {
  private final SourceProfile profile;
  private final String id;
  private final String localId;
  private final Label preferredHeading;
  private final ImmutableList<VariantHeading> variantHeadings;
  private final ImmutableList<BroaderReference> broaderReferences;
  private final ImmutableList<Label> definitions;

  AuthorityRecord(
      SourceProfile profile,
      String id,
      String localId,
      Label preferredHeading,
      List<VariantHeading> variantHeadings,
      List<BroaderReference> broaderReferences,
      List<Label> definitions) {
    this.profile = checkNotNull(profile);
    this.id = checkNotNull(id);
    this.localId = checkNotNull(localId);
    this.preferredHeading = checkNotNull(preferredHeading);
    this.variantHeadings = ImmutableList.copyOf(variantHeadings);
    this.broaderReferences = ImmutableList.copyOf(broaderReferences);
    this.definitions = ImmutableList.copyOf(definitions);
  }

  public SourceProfile getProfile() {
    return profile;
  }

  /** Identifier of the described item. */
  public String getId() {
    return id;
  }

  public String getLocalId() {
    return localId;
  }

  public String getControlNumber() {
    return profile.controlNumber(localId);
  }

  public Label getPreferredHeading() {
    return preferredHeading;
  }

  public ImmutableList<VariantHeading> getVariantHeadings() {
    return variantHeadings;
  }

  /** References to the ancestors, in chain order. */
  public ImmutableList<BroaderReference> getBroaderReferences() {
    return broaderReferences;
  }

  public ImmutableList<Label> getDefinitions() {
    return definitions;
  }

  @Override
  public String toString() {
    return MoreObjects.toStringHelper(this)
        .add("id", id)
        .add("heading", preferredHeading)
        .add("variants", variantHeadings.size())
        .add("broader", broaderReferences)
        .toString();
  }

  /** A see-from tracing. */
  public static final class VariantHeading {
    private final Label label;
    private final Optional<String> note;

    public VariantHeading(Label label, Optional<String> note) {
      this.label = checkNotNull(label);
      this.note = checkNotNull(note);
    }

    public Label getLabel() {
      return label;
    }

    public Optional<String> getNote() {
      return note;
    }
  }

  /** A see-also-from tracing to an ancestor. */
  public static final class BroaderReference {
    private final Label label;
    private final int order;
    private final String targetId;
    private final String targetLocalId;

    public BroaderReference(Label label, int order, String targetId, String targetLocalId) {
      checkArgument(order > 0, "order must be positive");
      this.label = checkNotNull(label);
      this.order = order;
      this.targetId = checkNotNull(targetId);
      this.targetLocalId = checkNotNull(targetLocalId);
    }

    public Label getLabel() {
      return label;
    }

    public int getOrder() {
      return order;
    }

    public String getTargetId() {
      return targetId;
    }

    public String getTargetLocalId() {
      return targetLocalId;
    }

    @Override
    public String toString() {
      return order + ":" + label;
    }
  }
}
