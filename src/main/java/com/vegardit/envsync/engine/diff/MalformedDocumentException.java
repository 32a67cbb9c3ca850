/*
 * SPDX-FileCopyrightText: © Vegard IT GmbH (https://vegardit.com)
 * SPDX-License-Identifier: Apache-2.0
 */
package com.vegardit.envsync.engine.diff;

import java.io.IOException;
import java.nio.file.Path;

/**
 * Thrown when a structured config document cannot be parsed.
 */
public class MalformedDocumentException extends IOException {

   private static final long serialVersionUID = 1L;

   public MalformedDocumentException(final Path file, final Throwable cause) {
      super("Malformed document [" + file + "]: " + cause.getMessage(), cause);
   }
}
