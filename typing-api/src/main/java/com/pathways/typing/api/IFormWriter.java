/*
 * Copyright (c) 2025 Pathways Typing Tool
 * Licensed under the Apache License, Version 2.0
 */
package com.pathways.typing.api;

import com.pathways.typing.api.form.FormDocument;

import java.io.IOException;

/**
 * Writes compiled form sheets into a container such as a spreadsheet workbook.
 */
public interface IFormWriter {

    void write(FormDocument document) throws IOException;
}
