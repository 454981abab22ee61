package com.ragsync.collect;

import java.io.IOException;

public interface Collector {

    String name();

    String source();

    CollectorResult collect() throws IOException;
}
