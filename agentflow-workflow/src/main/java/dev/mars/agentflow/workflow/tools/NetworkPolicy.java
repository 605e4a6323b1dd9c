/*
 * Copyright 2025 Mark Andrew Ray-Smith Cityline Ltd
 *
 * Licensed under the Apache License, Version 2.0 (the "License");
 * you may not use this file except in compliance with the License.
 * You may obtain a copy of the License at
 *
 *     http://www.apache.org/licenses/LICENSE-2.0
 *
 * Unless required by applicable law or agreed to in writing, software
 * distributed under the License is distributed on an "AS IS" BASIS,
 * WITHOUT WARRANTIES OR CONDITIONS OF ANY KIND, either express or implied.
 * See the License for the specific language governing permissions and
 * limitations under the License.
 */

package dev.mars.agentflow.workflow.tools;

import dev.mars.agentflow.core.exceptions.ErrorKind;
import dev.mars.agentflow.core.exceptions.WorkflowConfigurationException;
import dev.mars.agentflow.workflow.parser.Frontmatter;
import dev.mars.agentflow.workflow.parser.FrontmatterFields;
import dev.mars.agentflow.workflow.parser.WorkflowDocument;
import dev.mars.agentflow.workflow.parser.YamlSupport;

import java.util.Collection;
import java.util.List;
import java.util.Map;
import java.util.Set;
import java.util.TreeSet;

/**
 * Egress allow-list for the agent step.
 *
 * <p>An absent {@code network} section and the {@code defaults} keyword both
 * expand to a fixed list of infrastructure domains (certificate authorities,
 * schema hosts and Ubuntu mirrors).</p>
 *
 * @author Mark Andrew Ray-Smith Cityline Ltd
 * @since 2025-08-20
 * @version 1.0
 */
public final class NetworkPolicy {

    public static final String DEFAULTS = "defaults";
    public static final String WILDCARD = "*";

    static final List<String> DEFAULT_DOMAINS = List.of(
            "api.snapcraft.io",
            "archive.ubuntu.com",
            "azure.archive.ubuntu.com",
            "crl.geotrust.com",
            "crl.globalsign.com",
            "crl.identrust.com",
            "crl.sectigo.com",
            "crl.thawte.com",
            "crl.usertrust.com",
            "crl3.digicert.com",
            "crl4.digicert.com",
            "json-schema.org",
            "json.schemastore.org",
            "keyserver.ubuntu.com",
            "ocsp.digicert.com",
            "ppa.launchpad.net",
            "security.ubuntu.com");

    private final Set<String> allowed;
    private final Set<String> blocked;

    private NetworkPolicy(Collection<String> allowed, Collection<String> blocked) {
        this.allowed = new TreeSet<>(allowed);
        this.blocked = new TreeSet<>(blocked);
    }

    public static NetworkPolicy defaults() {
        return new NetworkPolicy(DEFAULT_DOMAINS, List.of());
    }

    /**
     * @throws WorkflowConfigurationException if {@code network} is neither {@code defaults} nor a mapping
     */
    public static NetworkPolicy parse(Frontmatter effective, WorkflowDocument root)
            throws WorkflowConfigurationException {
        Object value = effective.get(FrontmatterFields.NETWORK);
        if (value == null || DEFAULTS.equals(value)) {
            return defaults();
        }
        Map<String, Object> section = YamlSupport.asMap(value);
        if (section == null) {
            throw new WorkflowConfigurationException(ErrorKind.INVALID_CONFIGURATION, root.getSourcePath(),
                    root.getSourceMap().positionOf(FrontmatterFields.NETWORK), FrontmatterFields.NETWORK,
                    "network must be 'defaults' or a mapping with 'allowed' and 'blocked' lists");
        }
        Set<String> allowed = new TreeSet<>();
        for (String entry : ToolConfiguration.strings(section.get("allowed"))) {
            if (DEFAULTS.equals(entry)) {
                allowed.addAll(DEFAULT_DOMAINS);
            } else {
                allowed.add(entry);
            }
        }
        return new NetworkPolicy(allowed, ToolConfiguration.strings(section.get("blocked")));
    }

    /**
     * Domains the agent may reach: the declared ones plus the engine's own,
     * minus anything blocked, in lexical order.
     */
    public List<String> allowedDomains(Collection<String> engineDomains) {
        Set<String> result = new TreeSet<>(allowed);
        result.addAll(engineDomains);
        result.removeAll(blocked);
        return List.copyOf(result);
    }

    public Set<String> getAllowed() {
        return allowed;
    }

    public Set<String> getBlocked() {
        return blocked;
    }

    public boolean hasWildcard() {
        return allowed.contains(WILDCARD);
    }

    /**
     * @return the value of {@code AGENTFLOW_ALLOWED_DOMAINS} for the agent step
     */
    public String toEnvironmentValue(Collection<String> engineDomains) {
        return String.join(",", allowedDomains(engineDomains));
    }
}
