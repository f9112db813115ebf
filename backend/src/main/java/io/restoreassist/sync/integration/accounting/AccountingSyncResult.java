package io.restoreassist.sync.integration.accounting;

/** Result of a successful push: the document id assigned by the external system. */
public record AccountingSyncResult(String externalId) {}
