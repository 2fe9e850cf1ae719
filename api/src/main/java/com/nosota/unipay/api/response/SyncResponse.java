package com.nosota.unipay.api.response;

/**
 * Result of synchronizing scheduled payments of all active subscriptions.
 *
 * @param synced      Subscriptions that have their next payment scheduled after the run
 * @param skipped     Active subscriptions without a next billing date
 * @param created     Obligations created by this run
 * @param totalActive Active auto-renewing subscriptions inspected
 */
public record SyncResponse(
        int synced,
        int skipped,
        int created,
        int totalActive
) {}
