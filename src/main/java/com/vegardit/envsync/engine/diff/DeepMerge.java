/*
 * SPDX-FileCopyrightText: © Vegard IT GmbH (https://vegardit.com)
 * SPDX-License-Identifier: Apache-2.0
 */
package com.vegardit.envsync.engine.diff;

import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

import org.eclipse.jdt.annotation.Nullable;

/**
 * Recursive merge of a source document into a target document.
 * <ul>
 * <li>object + object: keys of both sides, values of common keys merged recursively. Target keys keep their
 * position, source-only keys are appended.
 * <li>list + list: all distinct elements of both sides. Elements are identified by their canonical form (see
 * {@link StructuredComparison#canonicalize(Object)}), so {@code 1} and {@code "1"} are distinct while objects
 * differing only in key order are duplicates. Target elements come first; a source element equal to a target
 * element replaces it in place. Duplicates within a single list collapse as well, so merging {@code {"a": [1, 1]}}
 * with itself yields {@code {"a": [1]}}.
 * <li>anything else: the source value.
 * </ul>
 * Apart from the collapsed list duplicates, merging a document with itself returns an equal document. The merge never
 * modifies its arguments.
 */
public final class DeepMerge {

   public static MergeResult merge(final @Nullable Object source, final @Nullable Object target) {
      int conflicts = 0;
      if (source instanceof final Map<?, ?> sourceMap && target instanceof final Map<?, ?> targetMap) {
         for (final var entry : sourceMap.entrySet()) {
            if (targetMap.containsKey(entry.getKey()) //
                  && !StructuredComparison.documentsEqual(entry.getValue(), targetMap.get(entry.getKey()))) {
               conflicts++;
            }
         }
      }
      return new MergeResult(mergeValues(source, target), conflicts);
   }

   private static @Nullable Object mergeValues(final @Nullable Object source, final @Nullable Object target) {
      if (source instanceof final Map<?, ?> sourceMap && target instanceof final Map<?, ?> targetMap)
         return mergeMaps(sourceMap, targetMap);
      if (source instanceof final List<?> sourceList && target instanceof final List<?> targetList)
         return mergeLists(sourceList, targetList);
      return source;
   }

   private static Map<Object, @Nullable Object> mergeMaps(final Map<?, ?> source, final Map<?, ?> target) {
      final var merged = new LinkedHashMap<Object, @Nullable Object>(target);
      for (final var entry : source.entrySet()) {
         final Object key = entry.getKey();
         if (merged.containsKey(key)) {
            merged.put(key, mergeValues(entry.getValue(), merged.get(key)));
         } else {
            merged.put(key, entry.getValue());
         }
      }
      return merged;
   }

   private static List<@Nullable Object> mergeLists(final List<?> source, final List<?> target) {
      final var byIdentity = new LinkedHashMap<String, @Nullable Object>();
      for (final var item : target) {
         byIdentity.putIfAbsent(StructuredComparison.canonicalize(item), item);
      }
      for (final var item : source) {
         // replacing the value of an existing key keeps its position
         byIdentity.put(StructuredComparison.canonicalize(item), item);
      }
      return new ArrayList<>(byIdentity.values());
   }

   private DeepMerge() {
   }
}
