package com.lbg.markets.surveillance.tail.source;

import java.io.IOException;
import java.nio.file.Path;
import java.util.List;

/**
 * Lists the files that should currently be tailed.
 */
public interface FileFinder {
    List<Path> find() throws IOException;
}
