/*
 * SPDX-FileCopyrightText: © Vegard IT GmbH (https://vegardit.com)
 * SPDX-License-Identifier: Apache-2.0
 */
package com.vegardit.envsync.util;

import java.io.Reader;
import java.lang.annotation.ElementType;
import java.lang.annotation.Retention;
import java.lang.annotation.RetentionPolicy;
import java.lang.annotation.Target;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Set;

import org.eclipse.jdt.annotation.Nullable;
import org.yaml.snakeyaml.DumperOptions;
import org.yaml.snakeyaml.LoaderOptions;
import org.yaml.snakeyaml.Yaml;
import org.yaml.snakeyaml.constructor.SafeConstructor;
import org.yaml.snakeyaml.introspector.Property;
import org.yaml.snakeyaml.nodes.MappingNode;
import org.yaml.snakeyaml.nodes.NodeTuple;
import org.yaml.snakeyaml.nodes.Tag;
import org.yaml.snakeyaml.representer.Representer;
import org.yaml.snakeyaml.resolver.Resolver;

/**
 * @author Sebastian Thomschke, Vegard IT GmbH
 */
public final class YamlUtils {

   /**
    * Customizes how a config field is rendered by {@link #toYamlString(Object)}.
    */
   @Retention(RetentionPolicy.RUNTIME)
   @Target(ElementType.FIELD)
   public @interface ToYamlString {
      boolean ignore() default false;

      String name() default "";
   }

   private static CharSequence camelCaseToHyphen(final String str) {
      if (str.isEmpty())
         return str;

      final var sb = new StringBuilder();
      Boolean previousCharIsUpperCase = null;
      for (final var ch : str.toCharArray()) {
         if (Character.isUpperCase(ch)) {
            if (previousCharIsUpperCase == Boolean.FALSE) {
               sb.append('-');
            }
            sb.append(Character.toLowerCase(ch));
            previousCharIsUpperCase = Boolean.TRUE;
         } else {
            sb.append(ch);
            previousCharIsUpperCase = Boolean.FALSE;
         }
      }
      return sb;
   }

   private static Yaml newLoader() {
      final var loaderOpts = new LoaderOptions();
      final var dumperOpts = new DumperOptions();
      return new Yaml(new SafeConstructor(loaderOpts), new Representer(dumperOpts), dumperOpts, loaderOpts, new Resolver() {
         @Override
         protected void addImplicitResolvers() {
            // keep timestamps like "since: 2025-09-04" as strings instead of resolving them to dates in UTC
            addImplicitResolver(Tag.STR, TIMESTAMP, "0123456789", 50);
            super.addImplicitResolvers();
         }
      });
   }

   /**
    * Loads a single YAML document of any shape (mapping, sequence or scalar).
    *
    * @return null for an empty document
    */
   public static @Nullable Object loadDocument(final Reader reader) {
      return newLoader().load(reader);
   }

   /**
    * Renders plain maps, lists and scalars in block style.
    */
   public static String dumpDocument(final @Nullable Object document) {
      final var options = new DumperOptions();
      options.setIndent(2);
      options.setDefaultFlowStyle(DumperOptions.FlowStyle.BLOCK);
      return new Yaml(options).dump(document);
   }

   /**
    * Loads a YAML config file whose root element is a mapping.
    *
    * @throws IllegalArgumentException if the root element is not a mapping
    */
   @SuppressWarnings("unchecked")
   public static Map<String, Object> parseYaml(final Reader reader) {
      final var doc = loadDocument(reader);
      if (doc == null)
         return new LinkedHashMap<>();
      if (doc instanceof Map)
         return (Map<String, Object>) doc;
      throw new IllegalArgumentException("Expected a YAML mapping as root element but found: " + doc.getClass().getSimpleName());
   }

   /**
    * Renders a config object as YAML with hyphenated property names.
    */
   public static String toYamlString(final Object obj) {
      final var options = new DumperOptions();
      options.setIndent(2);
      options.setPrettyFlow(true);
      options.setDefaultFlowStyle(DumperOptions.FlowStyle.BLOCK);
      final var representer = new Representer(options) {
         {
            multiRepresenters.put(java.nio.file.Path.class, obj -> representScalar(Tag.STR, obj.toString()));
            multiRepresenters.put(Enum.class, obj -> representScalar(Tag.STR, obj.toString()));
         }

         @Override
         protected MappingNode representJavaBean(final Set<Property> properties, final Object javaBean) {
            if (!classTags.containsKey(javaBean.getClass())) {
               // prevent rendering of object class as first line
               addClassTag(javaBean.getClass(), Tag.MAP);
            }

            return super.representJavaBean(properties, javaBean);
         }

         @Override
         protected @Nullable NodeTuple representJavaBeanProperty(final Object javaBean, final Property property,
               final @Nullable Object propertyValue, final Tag customTag) {
            final var anno = property.getAnnotation(ToYamlString.class);
            if (anno != null && anno.ignore())
               return null;

            final var node = super.representJavaBeanProperty(javaBean, property, propertyValue == null ? "<not configured>" : propertyValue,
               customTag);
            if (node == null)
               return null;

            final var name = anno == null || anno.name().isEmpty() ? property.getName() : anno.name();
            return new NodeTuple(representData(camelCaseToHyphen(name).toString()), node.getValueNode());
         }
      };

      return new Yaml(representer, options).dump(obj);
   }

   private YamlUtils() {
   }
}
