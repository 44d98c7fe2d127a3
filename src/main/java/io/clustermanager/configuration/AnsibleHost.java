package io.clustermanager.configuration;

import lombok.ToString;

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;

import static io.clustermanager.config.Constants.ANSIBLE_NODE_ADDR_HOST_VAR;
import static io.clustermanager.config.Constants.ANSIBLE_NODE_NAME_HOST_VAR;

/**
 * Host entry of an Ansible inventory: a tag, an ssh address, a group and host variables.
 */
@ToString
public class AnsibleHost implements HostConfiguration {

    private final String tag;
    private final String address;
    private String group;
    private final Map<String, String> vars = new LinkedHashMap<>();

    public AnsibleHost(String tag, String address, String group, Map<String, String> vars) {
        this.tag = tag;
        this.address = address;
        this.group = group;
        if (vars != null) {
            this.vars.putAll(vars);
        }
    }

    /**
     * Host entry for a node, carrying its name and address as host variables.
     */
    public static AnsibleHost forNode(String tag, String address) {
        Map<String, String> vars = new LinkedHashMap<>();
        vars.put(ANSIBLE_NODE_NAME_HOST_VAR, tag);
        vars.put(ANSIBLE_NODE_ADDR_HOST_VAR, address);
        return new AnsibleHost(tag, address, "", vars);
    }

    @Override
    public String getTag() {
        return tag;
    }

    @Override
    public String getAddress() {
        return address;
    }

    @Override
    public synchronized String getGroup() {
        return group;
    }

    @Override
    public synchronized void setGroup(String group) {
        this.group = group;
    }

    @Override
    public synchronized void setVar(String name, String value) {
        vars.put(name, value);
    }

    @Override
    public synchronized Map<String, String> getVars() {
        return Collections.unmodifiableMap(new LinkedHashMap<>(vars));
    }

    @Override
    public synchronized AnsibleHost copy() {
        return new AnsibleHost(tag, address, group, vars);
    }
}
