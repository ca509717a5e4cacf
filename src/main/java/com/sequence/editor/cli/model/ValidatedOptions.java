package com.sequence.editor.cli.model;

import java.nio.charset.Charset;
import java.nio.file.Path;

import lombok.AllArgsConstructor;
import lombok.Data;

/**
 * Options after validation. {@code target} is {@code null} when output goes to stdout.
 */
@Data
@AllArgsConstructor
public class ValidatedOptions {
    Path input;
    Path target;
    Charset charset;
}
