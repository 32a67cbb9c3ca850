/*
 * SPDX-FileCopyrightText: © Vegard IT GmbH (https://vegardit.com)
 * SPDX-License-Identifier: Apache-2.0
 */
package com.vegardit.envsync.engine.diff;

import static org.assertj.core.api.Assertions.assertThat;

import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import com.fasterxml.jackson.core.JsonProcessingException;

class DeepMergeTest {

   private static Object json(final String json) throws JsonProcessingException {
      return StructuredFormat.JSON_MAPPER.readValue(json, Object.class);
   }

   @Test
   @DisplayName("Nested objects are merged key by key")
   void testNestedObjects() throws JsonProcessingException {
      final var result = DeepMerge.merge(json("""
         {"a": 1, "b": {"c": 2}}"""), json("""
         {"b": {"d": 3}, "e": 4}"""));

      assertThat(StructuredComparison.documentsEqual(result.document(), json("""
         {"a": 1, "b": {"c": 2, "d": 3}, "e": 4}"""))).isTrue();
      assertThat(result.conflictsResolved()).isEqualTo(1);
   }

   @Test
   void testTargetKeysComeFirst() throws JsonProcessingException {
      final var result = DeepMerge.merge(json("""
         {"a": 1, "b": 2}"""), json("""
         {"c": 3, "b": 0}"""));

      assertThat(StructuredFormat.JSON_MAPPER.writeValueAsString(result.document())).isEqualTo("""
         {"c":3,"b":2,"a":1}""");
      assertThat(result.conflictsResolved()).isEqualTo(1);
   }

   @Test
   @DisplayName("Merging a document into itself yields the same document")
   void testIdempotence() throws JsonProcessingException {
      final var doc = json("""
         {"name": "x", "tags": ["a", "b"], "nested": {"list": [{"k": 1}, {"k": 2}], "flag": true}}""");
      final var result = DeepMerge.merge(doc, doc);

      assertThat(StructuredComparison.documentsEqual(result.document(), doc)).isTrue();
      assertThat(result.conflictsResolved()).isZero();
   }

   @Test
   @DisplayName("Merging a list containing duplicates with itself collapses the duplicates")
   void testSelfMergeCollapsesListDuplicates() throws JsonProcessingException {
      final var doc = json("""
         {"a": [1, 1, "x", "x"]}""");
      final var result = DeepMerge.merge(doc, doc);

      assertThat(StructuredComparison.canonicalize(result.document())).isEqualTo("""
         {"a":[1,"x"]}""");
      assertThat(result.conflictsResolved()).isZero();
   }

   @Test
   void testListsAreUnitedWithoutDuplicates() throws JsonProcessingException {
      final var result = DeepMerge.merge(json("""
         ["b", "c", {"y": 2, "x": 1}]"""), json("""
         ["a", "b", {"x": 1, "y": 2}]"""));

      assertThat(result.document()).isInstanceOf(List.class);
      assertThat(StructuredComparison.canonicalize(result.document())).isEqualTo("""
         ["a","b",{"x":1,"y":2},"c"]""");
      assertThat(result.conflictsResolved()).isZero();
   }

   @Test
   @DisplayName("Numbers and strings with the same text are distinct list elements")
   void testListDeduplicationIsTypeAware() throws JsonProcessingException {
      final var result = DeepMerge.merge(json("[1]"), json("[\"1\"]"));
      assertThat(StructuredComparison.canonicalize(result.document())).isEqualTo("[\"1\",1]");
   }

   @Test
   @DisplayName("On a type mismatch the source value wins")
   void testTypeMismatch() throws JsonProcessingException {
      final var result = DeepMerge.merge(json("""
         {"a": [1, 2]}"""), json("""
         {"a": {"b": 1}}"""));
      assertThat(StructuredComparison.documentsEqual(result.document(), json("""
         {"a": [1, 2]}"""))).isTrue();
      assertThat(result.conflictsResolved()).isEqualTo(1);

      assertThat(DeepMerge.merge("text", json("{}")).document()).isEqualTo("text");
   }

   @Test
   void testArgumentsAreNotModified() throws JsonProcessingException {
      final var source = new LinkedHashMap<String, Object>(Map.of("a", 1));
      final var target = new LinkedHashMap<String, Object>(Map.of("b", 2));
      DeepMerge.merge(source, target);
      assertThat(source).containsOnlyKeys("a");
      assertThat(target).containsOnlyKeys("b");
   }
}
