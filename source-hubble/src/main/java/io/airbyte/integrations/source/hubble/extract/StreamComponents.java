/*
 * Copyright (c) 2020-2025 Airbyte, Inc., all rights reserved.
 */

package io.airbyte.integrations.source.hubble.extract;

import io.airbyte.integrations.source.hubble.http.RetryPolicy;
import io.airbyte.integrations.source.hubble.pagination.Paginator;
import io.airbyte.integrations.source.hubble.schema.SchemaSource;

/**
 * The strategies one stream is extracted with.
 */
public record StreamComponents(Paginator paginator, RetryPolicy retryPolicy, SchemaSource schemaSource) {}
