// Copyright (c) Microsoft Corporation.
// Licensed under the MIT License.

package com.microsoft.azure.kusto.core.data;

import org.jetbrains.annotations.Nullable;

public enum WellKnownDataSet {
    PrimaryResult,
    QueryCompletionInformation,
    TableOfContents,
    QueryProperties;

    /**
     * @return the matching data set, or null for kinds this client does not model (e.g. QueryTraceLog)
     */
    @Nullable
    public static WellKnownDataSet fromKindName(@Nullable String kind) {
        if (kind == null) {
            return null;
        }
        for (WellKnownDataSet dataSet : values()) {
            if (dataSet.name().equals(kind)) {
                return dataSet;
            }
        }
        return null;
    }
}
