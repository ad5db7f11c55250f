package com.microsoft.azure.kusto.core.ingest.utils;

import java.util.Collections;
import java.util.List;
import java.util.Random;

public class DefaultRandomProvider implements RandomProvider {
    private final Random random;

    public DefaultRandomProvider(Random random) {
        this.random = random;
    }

    public DefaultRandomProvider() {
        this(new Random());
    }

    @Override
    public void shuffle(List<?> list) {
        Collections.shuffle(list, random);
    }
}
