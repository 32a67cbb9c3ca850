/*
 * SPDX-FileCopyrightText: © Vegard IT GmbH (https://vegardit.com)
 * SPDX-License-Identifier: Apache-2.0
 */
package com.vegardit.envsync.engine;

public enum SyncItemKind {
   FILE,
   DIRECTORY,
   STRUCTURED_CONFIG,
   REPOSITORY
}
