/**
 * Typed record payloads. The {@code kind} property selects the subtype; unknown
 * properties are kept as extensions.
 */
package com.purchasingpower.infragraph.model.payload;
