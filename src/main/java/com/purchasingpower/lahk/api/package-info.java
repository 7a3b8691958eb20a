/**
 * REST API layer: controllers and DTOs.
 *
 * <p>Exposes the flowchart compiler to editor and rendering clients:
 * <ul>
 *   <li>Graph API - parse a document into nodes, edges and validation messages</li>
 *   <li>Diagnostics API - line-ranged problems plus a status summary</li>
 *   <li>Edit API - write an edited node label back into the source</li>
 *   <li>Dump API - text report of nodes, edges and validation errors</li>
 * </ul>
 *
 * @since 1.0.0
 */
package com.purchasingpower.lahk.api;
