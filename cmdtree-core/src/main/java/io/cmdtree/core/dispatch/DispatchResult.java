package io.cmdtree.core.dispatch;

import io.cmdtree.core.parse.Context;

/** A completed parse and what its action returned, possibly {@code null}. */
public record DispatchResult(Context context, Object value) {}
