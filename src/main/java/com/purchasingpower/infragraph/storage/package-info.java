/**
 * Persistence boundary keyed by object id and tier, plus payload encoding.
 */
package com.purchasingpower.infragraph.storage;
