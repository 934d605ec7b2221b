package com.splitttr.formcollab.client;

import com.splitttr.formcollab.message.FormField;

import java.time.Instant;
import java.util.List;

public record DocumentResponse(
    String id,
    String title,
    List<FormField> fields,
    String ownerId,
    List<String> editorIds,
    Instant createdAt,
    Instant updatedAt,
    long version
) {}
