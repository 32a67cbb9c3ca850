/*
 * SPDX-FileCopyrightText: © Vegard IT GmbH (https://vegardit.com)
 * SPDX-License-Identifier: Apache-2.0
 */
package com.vegardit.envsync.engine.diff;

import org.eclipse.jdt.annotation.Nullable;

/**
 * @param document the merged document
 * @param conflictsResolved number of top-level object keys present on both sides with differing values
 */
public record MergeResult(@Nullable Object document, int conflictsResolved) {
}
