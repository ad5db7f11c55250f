// Copyright (c) Microsoft Corporation.
// Licensed under the MIT License.

package com.microsoft.azure.kusto.core.data;

import org.apache.commons.lang3.StringUtils;

public class Ensure {
    private Ensure() {
        // Hide constructor, as this is a static utility class
    }

    public static void stringIsNotBlank(String str, String varName) {
        if (StringUtils.isBlank(str)) {
            throw new IllegalArgumentException(varName + " is blank.");
        }
    }

    public static void argIsNotNull(Object arg, String varName) {
        if (arg == null) {
            throw new IllegalArgumentException(varName + " is null.");
        }
    }

    public static void isTrue(boolean condition, String message) {
        if (!condition) {
            throw new IllegalArgumentException("Condition evaluated to false: " + message);
        }
    }
}
