package com.invoiceguard.backend.services.forensics;

/**
 * Common shape of every detector payload. {@code error} is non-null only when the
 * detector fell back to its fixed inconclusive score.
 */
public interface DetectorResult {

    double score();

    String verdict();

    String error();
}
