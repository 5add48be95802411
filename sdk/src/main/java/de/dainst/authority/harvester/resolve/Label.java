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

import com.google.common.base.Objects;
import com.google.common.base.Strings;
import java.util.Optional;

/** A label text with its optional language tag. */
public final class Label {
  private final String text;
  private final Optional<String> language;

  private Label(String text, Optional<String> language) {
    this.text = text;
    this.language = language;
  }

  /**
   * @param text non-empty label text
   * @param language language tag; {@code null} or empty means no language
   */
  public static Label of(String text, String language) {
    checkNotNull(text, "label text can not be null");
    checkArgument(!text.trim().isEmpty(), "label text can not be empty");
    return new Label(text.trim(), Optional.ofNullable(Strings.emptyToNull(language)));
  }

  public static Label of(String text) {
    return of(text, null);
  }

  public String getText() {
    return text;
  }

  public Optional<String> getLanguage() {
    return language;
  }

  public boolean hasLanguage(String tag) {
    return language.isPresent() && language.get().equalsIgnoreCase(tag);
  }

  @Override
  public boolean equals(Object o) {
    if (this == o) {
      return true;
    }
    if (!(o instanceof Label)) {
      return false;
    }
    Label other = (Label) o;
    return text.equals(other.text) && language.equals(other.language);
  }

  @Override
  public int hashCode() {
    return Objects.hashCode(text, language);
  }

  @Override
  public String toString() {
    return language.map(l -> text + "@" + l).orElse(text);
  }
}
