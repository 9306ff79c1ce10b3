/**
 * Versioning services: tier resolution, copy-on-write writes and lifecycle transitions.
 *
 * <p>Three tiers are stacked per workspace:
 * <ul>
 *   <li>Head - the merged baseline</li>
 *   <li>Change set - a reviewable branch of proposed edits</li>
 *   <li>Edit session - a single-writer working copy under one change set</li>
 * </ul>
 *
 * <p>Key classes:
 * <ul>
 *   <li>{@code VersionedEntityStore} - resolve, write and list records</li>
 *   <li>{@code EditSessionService} - promote drafts into the change set on save</li>
 *   <li>{@code ChangeSetService} - promote change set rows into Head on apply</li>
 *   <li>{@code TierTransactions} - transaction boundary and exception translation</li>
 *   <li>{@code ChangeEventBroadcaster} - delivers committed change events to subscribers</li>
 * </ul>
 */
package com.purchasingpower.infragraph.service;
