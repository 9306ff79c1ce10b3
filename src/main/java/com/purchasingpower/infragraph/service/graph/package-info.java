/**
 * Tier-aware edge queries. Edges whose far vertex cannot be resolved are omitted.
 */
package com.purchasingpower.infragraph.service.graph;
