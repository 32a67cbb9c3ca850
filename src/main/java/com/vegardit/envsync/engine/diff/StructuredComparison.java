/*
 * SPDX-FileCopyrightText: © Vegard IT GmbH (https://vegardit.com)
 * SPDX-License-Identifier: Apache-2.0
 */
package com.vegardit.envsync.engine.diff;

import java.io.IOException;
import java.io.UncheckedIOException;
import java.math.BigDecimal;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.Collection;
import java.util.List;
import java.util.Map;
import java.util.TreeMap;

import org.eclipse.jdt.annotation.Nullable;

import com.fasterxml.jackson.core.JsonProcessingException;

import net.sf.jstuff.core.logging.Logger;

/**
 * Structural equality of structured config documents. Object key order is irrelevant, list order is significant.
 * Numbers are compared by value, so {@code 1} equals {@code 1.0}, but a number never equals a string.
 */
public final class StructuredComparison {

   private static final Logger LOG = Logger.create();

   /**
    * Serializes the given document as compact JSON with object keys sorted and numbers in their shortest exact form, so that two structurally equal documents
    * produce the same string.
    */
   public static String canonicalize(final @Nullable Object document) {
      try {
         return StructuredFormat.JSON_MAPPER.writeValueAsString(normalize(document));
      } catch (final JsonProcessingException ex) {
         throw new UncheckedIOException(ex);
      }
   }

   private static @Nullable Object normalize(final @Nullable Object value) {
      if (value instanceof final Map<?, ?> map) {
         final var sorted = new TreeMap<String, @Nullable Object>();
         for (final var entry : map.entrySet()) {
            sorted.put(String.valueOf(entry.getKey()), normalize(entry.getValue()));
         }
         return sorted;
      }
      if (value instanceof final Collection<?> items) {
         final List<@Nullable Object> normalized = new ArrayList<>(items.size());
         for (final var item : items) {
            normalized.add(normalize(item));
         }
         return normalized;
      }
      if (value instanceof final Number number)
         return normalizeNumber(number);
      return value;
   }

   private static Object normalizeNumber(final Number number) {
      if (number instanceof final Double d && (d.isNaN() || d.isInfinite()) //
            || number instanceof final Float f && (f.isNaN() || f.isInfinite()))
         return number;
      final var decimal = (number instanceof final BigDecimal bd ? bd : new BigDecimal(number.toString())).stripTrailingZeros();
      return decimal.scale() <= 0 ? decimal.toBigIntegerExact() : decimal;
   }

   public static boolean documentsEqual(final @Nullable Object left, final @Nullable Object right) {
      return canonicalize(left).equals(canonicalize(right));
   }

   /**
    * Parses both files with the format matching their extension and compares them structurally.
    * <p>
    * Never throws: a file that cannot be read or parsed makes the documents unequal, so that a synchronization is
    * attempted and reports the actual problem.
    */
   public static boolean filesEqual(final Path source, final Path target) {
      final var format = StructuredFormat.forPath(source);
      if (format == null) {
         LOG.warn("Unsupported structured config format [%s].", source);
         return false;
      }
      try {
         return documentsEqual(format.read(source), format.read(target));
      } catch (final IOException | RuntimeException ex) {
         LOG.warn("Cannot compare [%s] with [%s]: %s", source, target, ex.getMessage());
         return false;
      }
   }

   private StructuredComparison() {
   }
}
