/*
 * Copyright (c) 2025 Pathways Typing Tool
 * Licensed under the Apache License, Version 2.0
 */
package com.pathways.typing.api;

import com.pathways.typing.api.model.CartModelDefinition;
import com.pathways.typing.api.model.Stratum;

import java.io.IOException;

/**
 * Retrieves the serialized tree of a stratum from wherever fitted models are stored.
 */
public interface ICartModelSource {

    CartModelDefinition load(Stratum stratum) throws IOException;
}
