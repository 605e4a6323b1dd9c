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

package dev.mars.agentflow.permissions;

import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import java.util.ArrayList;
import java.util.EnumMap;
import java.util.List;
import java.util.Map;

import static org.junit.jupiter.api.Assertions.*;

class PermissionsRendererTest {

    @Test
    @DisplayName("Shorthand renders as a scalar")
    void shorthand() {
        assertEquals("read-all", PermissionsRenderer.toYamlValue(Permissions.readAll()));
        assertEquals("read-all\n", PermissionsRenderer.render(Permissions.readAll()));
    }

    @Test
    @DisplayName("Maps render in lexical order without metadata and organization-projects")
    void lexicalOrderAndExclusions() {
        Map<PermissionScope, PermissionLevel> levels = new EnumMap<>(PermissionScope.class);
        levels.put(PermissionScope.STATUSES, PermissionLevel.READ);
        levels.put(PermissionScope.METADATA, PermissionLevel.READ);
        levels.put(PermissionScope.ORGANIZATION_PROJECTS, PermissionLevel.WRITE);
        levels.put(PermissionScope.ID_TOKEN, PermissionLevel.WRITE);
        levels.put(PermissionScope.ACTIONS, PermissionLevel.READ);

        @SuppressWarnings("unchecked")
        Map<String, String> rendered = (Map<String, String>) PermissionsRenderer.toYamlValue(Permissions.explicit(levels));

        assertEquals(List.of("actions", "id-token", "statuses"), new ArrayList<>(rendered.keySet()));
        assertEquals("actions: read\nid-token: write\nstatuses: read\n",
                PermissionsRenderer.render(Permissions.explicit(levels)));
    }

    @Test
    @DisplayName("Empty explicit permissions render as an empty map")
    void emptyMap() {
        assertEquals("{}\n", PermissionsRenderer.render(Permissions.empty()));
    }

    @Test
    @DisplayName("Rendered permissions re-parse to an equal value")
    void roundTrip() throws Exception {
        Permissions explicit = Permissions.explicit(Map.of(PermissionScope.ISSUES, PermissionLevel.WRITE,
                PermissionScope.PULL_REQUESTS, PermissionLevel.READ));
        assertEquals(explicit, PermissionsParser.parse(PermissionsRenderer.render(explicit)));

        Permissions shorthand = Permissions.writeAll();
        assertEquals(shorthand, PermissionsParser.parse(PermissionsRenderer.render(shorthand)));

        Permissions withMetadata = Permissions.explicit(Map.of(PermissionScope.METADATA, PermissionLevel.READ,
                PermissionScope.CONTENTS, PermissionLevel.READ));
        assertEquals(Permissions.explicit(Map.of(PermissionScope.CONTENTS, PermissionLevel.READ)),
                PermissionsParser.parse(PermissionsRenderer.render(withMetadata)));

        Permissions blanket = Permissions.blanket(PermissionLevel.READ, Map.of(PermissionScope.ISSUES, PermissionLevel.WRITE));
        Permissions reparsed = PermissionsParser.parse(PermissionsRenderer.render(blanket));
        assertTrue(reparsed.isEquivalentTo(blanket.merge(Permissions.empty())
                .with(PermissionScope.METADATA, PermissionLevel.NONE)
                .with(PermissionScope.ORGANIZATION_PROJECTS, PermissionLevel.NONE)));
    }
}
