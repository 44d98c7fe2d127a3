package io.clustermanager.configuration;

import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * Renders hosts as an INI formatted Ansible inventory, one section per group.
 */
public final class AnsibleInventory {

    private static final String SSH_HOST_VAR = "ansible_ssh_host";

    private AnsibleInventory() {
        // Utility class
    }

    public static String render(List<? extends HostConfiguration> hosts) {
        Map<String, StringBuilder> sections = new LinkedHashMap<>();
        for (HostConfiguration host : hosts) {
            String group = host.getGroup() == null || host.getGroup().isBlank() ? "ungrouped" : host.getGroup();
            StringBuilder section = sections.computeIfAbsent(group, g -> new StringBuilder());
            section.append(host.getTag())
                .append(' ').append(SSH_HOST_VAR).append('=').append(quote(host.getAddress()));
            for (Map.Entry<String, String> var : host.getVars().entrySet()) {
                section.append(' ').append(var.getKey()).append('=').append(quote(var.getValue()));
            }
            section.append('\n');
        }

        StringBuilder inventory = new StringBuilder();
        for (Map.Entry<String, StringBuilder> section : sections.entrySet()) {
            if (inventory.length() > 0) {
                inventory.append('\n');
            }
            inventory.append('[').append(section.getKey()).append("]\n").append(section.getValue());
        }
        return inventory.toString();
    }

    private static String quote(String value) {
        if (value == null || value.isEmpty()) {
            return "\"\"";
        }
        if (value.chars().anyMatch(c -> Character.isWhitespace(c) || c == '"' || c == '=')) {
            return '"' + value.replace("\"", "\\\"") + '"';
        }
        return value;
    }
}
