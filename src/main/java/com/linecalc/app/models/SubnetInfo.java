package com.linecalc.app.models;

/**
 * Derived facts about one IPv4 subnet.
 */
public class SubnetInfo {
    private final String networkAddress;
    private final int prefix;
    private final String mask;
    private final String broadcast;
    private final String firstHost;
    private final String lastHost;
    private final long hostCount;

    public SubnetInfo(String networkAddress, int prefix, String mask, String broadcast,
                      String firstHost, String lastHost, long hostCount) {
        this.networkAddress = networkAddress;
        this.prefix = prefix;
        this.mask = mask;
        this.broadcast = broadcast;
        this.firstHost = firstHost;
        this.lastHost = lastHost;
        this.hostCount = hostCount;
    }

    public String getNetworkAddress() {
        return networkAddress;
    }

    public int getPrefix() {
        return prefix;
    }

    public String getMask() {
        return mask;
    }

    public String getBroadcast() {
        return broadcast;
    }

    public String getFirstHost() {
        return firstHost;
    }

    public String getLastHost() {
        return lastHost;
    }

    public long getHostCount() {
        return hostCount;
    }

    public String getCidr() {
        return networkAddress + "/" + prefix;
    }
}
