package com.delta.digest.aggregate.api;

import com.delta.digest.aggregate.model.Entry;

import java.util.List;

public record DigestApiImagesRequest(List<Entry> entries) {
}
