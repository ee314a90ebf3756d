/**
 * Command catalog exposed at the protocol boundary.
 *
 * <p>Each {@link com.ryuqq.gateway.application.command.CommandProvider} in this package declares
 * the input shape of its commands and renders directory results as text. Directory failures are
 * left to propagate so that the dispatcher reports them uniformly; only lookups turn a missing
 * entity into an informational result.</p>
 *
 * <ul>
 *   <li>{@link com.ryuqq.gateway.adapter.tools.UserCommands}: user lifecycle, lookup and attribute search</li>
 *   <li>{@link com.ryuqq.gateway.adapter.tools.GroupCommands}: groups and memberships</li>
 *   <li>{@link com.ryuqq.gateway.adapter.tools.OnboardingCommands}: CSV import, group mapping and provisioning</li>
 *   <li>{@link com.ryuqq.gateway.adapter.tools.DirectoryCommandCatalog}: wiring of all of the above</li>
 * </ul>
 */
package com.ryuqq.gateway.adapter.tools;
