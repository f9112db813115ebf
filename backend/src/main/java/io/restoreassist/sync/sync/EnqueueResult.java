package io.restoreassist.sync.sync;

import java.util.UUID;

public record EnqueueResult(UUID jobId, UUID invoiceId, String provider, SyncPriority priority) {}
