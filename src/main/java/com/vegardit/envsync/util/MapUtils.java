/*
 * SPDX-FileCopyrightText: © Vegard IT GmbH (https://vegardit.com)
 * SPDX-License-Identifier: Apache-2.0
 */
package com.vegardit.envsync.util;

import java.nio.file.InvalidPathException;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.List;
import java.util.Map;

import org.eclipse.jdt.annotation.Nullable;

/**
 * Typed accessors for loosely typed config maps as produced by {@link YamlUtils#parseYaml(java.io.Reader)}.
 *
 * @author Sebastian Thomschke, Vegard IT GmbH
 */
public final class MapUtils {

   public static @Nullable <T> Boolean getBoolean(final Map<T, ?> map, final T key, final boolean remove) {
      final var value = remove ? map.remove(key) : map.get(key);
      if (value == null)
         return null; // CHECKSTYLE:IGNORE .*
      if (value instanceof final Boolean b)
         return b;
      final var str = value.toString().trim();
      if ("true".equalsIgnoreCase(str) || "yes".equalsIgnoreCase(str))
         return Boolean.TRUE;
      if ("false".equalsIgnoreCase(str) || "no".equalsIgnoreCase(str))
         return Boolean.FALSE;
      throw new IllegalArgumentException("Cannot parse attribute [" + key + "] with value [" + value + "] as boolean.");
   }

   public static @Nullable <T> Integer getInteger(final Map<T, ?> map, final T key, final boolean remove) {
      final var value = remove ? map.remove(key) : map.get(key);
      if (value == null)
         return null;
      if (value instanceof final Number n)
         return n.intValue();
      try {
         return Integer.parseInt(value.toString().trim());
      } catch (final NumberFormatException ex) {
         throw new IllegalArgumentException("Cannot parse attribute [" + key + "] with value [" + value + "] as integer. " + ex
            .getMessage(), ex);
      }
   }

   public static @Nullable <T> String getString(final Map<T, ?> map, final T key, final boolean remove) {
      final var value = remove ? map.remove(key) : map.get(key);
      if (value == null)
         return null;
      if (value instanceof Map || value instanceof List)
         throw new IllegalArgumentException("Cannot parse attribute [" + key + "] with value [" + value + "] as string.");
      return value.toString();
   }

   public static @Nullable <T> Path getPath(final Map<T, ?> map, final T key, final boolean remove) {
      final var value = getString(map, key, remove);
      if (value == null)
         return null;
      try {
         return Path.of(value);
      } catch (final InvalidPathException ex) {
         throw new IllegalArgumentException("Cannot parse attribute [" + key + "] with value [" + value + "] as path. " + ex.getMessage(),
            ex);
      }
   }

   /**
    * A single scalar value is treated as a list with one element.
    */
   public static @Nullable <T> List<String> getStringList(final Map<T, ?> map, final T key, final boolean remove) {
      final var value = remove ? map.remove(key) : map.get(key);
      if (value == null)
         return null;
      if (value instanceof final List<?> list) {
         final var result = new ArrayList<String>(list.size());
         for (final var item : list) {
            if (item == null)
               throw new IllegalArgumentException("Attribute [" + key + "] must not contain empty list entries.");
            result.add(item.toString());
         }
         return result;
      }
      if (value instanceof Map)
         throw new IllegalArgumentException("Cannot parse attribute [" + key + "] with value [" + value + "] as a list.");
      return new ArrayList<>(List.of(value.toString()));
   }

   private MapUtils() {
   }
}
