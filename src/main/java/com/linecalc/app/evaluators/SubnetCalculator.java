package com.linecalc.app.evaluators;

import com.linecalc.app.exceptions.DomainException;
import com.linecalc.app.models.SubnetInfo;

import java.util.ArrayList;
import java.util.List;

/**
 * IPv4 subnet arithmetic. Addresses are handled as four big-endian octets.
 */
public final class SubnetCalculator {

    /**
     * Upper bound on the number of subnets a split may list.
     */
    public static final int MAX_SUBNETS = 1024;

    private SubnetCalculator() {
    }

    public static SubnetInfo parseCidr(String cidr) {
        int slash = cidr.indexOf('/');
        if (slash < 0) {
            throw new DomainException("invalid CIDR: " + cidr);
        }
        int[] ip = parseAddress(cidr.substring(0, slash));
        int prefix = parsePrefix(cidr.substring(slash + 1));
        return describe(applyMask(ip, maskOctets(prefix)), prefix);
    }

    static SubnetInfo describe(int[] network, int prefix) {
        int[] mask = maskOctets(prefix);
        int[] broadcast = new int[4];
        for (int i = 0; i < 4; i++) {
            broadcast[i] = network[i] | (~mask[i] & 0xFF);
        }

        String first;
        String last;
        if (32 - prefix <= 1) {
            first = format(network);
            last = format(network);
        } else {
            first = format(addToAddress(network, 1));
            last = format(addToAddress(broadcast, -1));
        }
        return new SubnetInfo(format(network), prefix, format(mask), format(broadcast),
                first, last, hostsInPrefix(prefix));
    }

    /**
     * Usable hosts: network and broadcast excluded, except /31 (point-to-point) and /32.
     */
    public static long hostsInPrefix(int prefix) {
        checkPrefix(prefix);
        if (prefix == 32) {
            return 1;
        }
        if (prefix == 31) {
            return 2;
        }
        return (1L << (32 - prefix)) - 2;
    }

    public static String calculateMask(int prefix) {
        return format(maskOctets(prefix));
    }

    public static String wildcardMask(int prefix) {
        int[] mask = maskOctets(prefix);
        int[] wildcard = new int[4];
        for (int i = 0; i < 4; i++) {
            wildcard[i] = ~mask[i] & 0xFF;
        }
        return format(wildcard);
    }

    /**
     * Counts the leading one bits of a mask; a mask whose ones are not
     * contiguous is rejected.
     */
    public static int prefixFromMask(String mask) {
        int[] octets = parseAddress(mask);
        long bits = toLong(octets);
        int ones = Long.bitCount(bits);
        long canonical = ones == 0 ? 0 : (0xFFFFFFFFL << (32 - ones)) & 0xFFFFFFFFL;
        if (bits != canonical) {
            throw new DomainException("non-contiguous mask: " + mask);
        }
        return ones;
    }

    /**
     * Splits a network into 'count' equal aligned subnets, using the smallest
     * power of two that is at least 'count'.
     */
    public static List<SubnetInfo> splitToSubnets(String cidr, int count) {
        if (count < 1) {
            throw new DomainException("subnet count must be positive: " + count);
        }
        SubnetInfo base = parseCidr(cidr);
        int additionalBits = ceilLog2(count);
        int newPrefix = base.getPrefix() + additionalBits;
        if (newPrefix > 32) {
            throw new DomainException("cannot split /" + base.getPrefix() + " into " + count + " subnets");
        }
        if (count > MAX_SUBNETS) {
            throw new DomainException("too many subnets: " + count);
        }
        long actual = 1L << additionalBits;
        return allocate(base, newPrefix, (int) Math.min(actual, count));
    }

    /**
     * Splits a network into the smallest subnets that still hold 'hosts' usable addresses.
     */
    public static List<SubnetInfo> splitByHostCount(String cidr, int hosts) {
        if (hosts < 1) {
            throw new DomainException("host count must be positive: " + hosts);
        }
        SubnetInfo base = parseCidr(cidr);
        int hostBits = Math.max(2, ceilLog2((long) hosts + 2));
        int newPrefix = 32 - hostBits;
        if (newPrefix < base.getPrefix()) {
            throw new DomainException("cannot fit " + hosts + " hosts in /" + base.getPrefix() + " network");
        }
        long subnetCount = 1L << (newPrefix - base.getPrefix());
        if (subnetCount > MAX_SUBNETS) {
            throw new DomainException("too many subnets: " + subnetCount);
        }
        return allocate(base, newPrefix, (int) subnetCount);
    }

    private static List<SubnetInfo> allocate(SubnetInfo base, int newPrefix, int count) {
        int[] start = parseAddress(base.getNetworkAddress());
        long subnetSize = 1L << (32 - newPrefix);
        List<SubnetInfo> subnets = new ArrayList<>(count);
        for (int i = 0; i < count; i++) {
            subnets.add(describe(addToAddress(start, i * subnetSize), newPrefix));
        }
        return subnets;
    }

    public static boolean contains(String cidr, String address) {
        SubnetInfo info = parseCidr(cidr);
        int[] ip = parseAddress(address);
        int[] network = parseAddress(info.getNetworkAddress());
        int[] masked = applyMask(ip, maskOctets(info.getPrefix()));
        for (int i = 0; i < 4; i++) {
            if (masked[i] != network[i]) {
                return false;
            }
        }
        return true;
    }

    /**
     * The adjacent subnet of the same size, wrapping past 255.255.255.255.
     */
    public static String nextSubnet(String cidr) {
        SubnetInfo info = parseCidr(cidr);
        long size = 1L << (32 - info.getPrefix());
        int[] next = addToAddress(parseAddress(info.getNetworkAddress()), size);
        return format(next) + "/" + info.getPrefix();
    }

    public static String formatSubnetInfo(SubnetInfo info) {
        return "Network: " + info.getCidr()
                + "\nMask: " + info.getMask()
                + "\nHosts: " + info.getHostCount()
                + "\nRange: " + info.getFirstHost() + " - " + info.getLastHost()
                + "\nBroadcast: " + info.getBroadcast();
    }

    /**
     * One subnet per line as "i: addr/prefix [Nh]". The short "h" keeps the
     * lines from reading as host-count phrasings.
     */
    public static String formatSubnetList(List<SubnetInfo> subnets) {
        if (subnets.isEmpty()) {
            return "no subnets";
        }
        StringBuilder sb = new StringBuilder();
        for (int i = 0; i < subnets.size(); i++) {
            SubnetInfo s = subnets.get(i);
            if (i > 0) {
                sb.append('\n');
            }
            sb.append(i + 1).append(": ").append(s.getCidr()).append(" [").append(s.getHostCount()).append("h]");
        }
        return sb.toString();
    }

    // ----------------------------------------------------------------
    // Octet helpers
    // ----------------------------------------------------------------

    /**
     * Adds a signed offset with carry (or borrow) from the lowest octet up.
     * Overflow past the top octet is dropped.
     */
    static int[] addToAddress(int[] ip, long offset) {
        int[] result = ip.clone();
        long carry = offset;
        for (int i = 3; i >= 0 && carry != 0; i--) {
            long sum = result[i] + carry;
            result[i] = (int) (sum & 0xFF);
            carry = sum >> 8;
        }
        return result;
    }

    static int[] parseAddress(String address) {
        String[] parts = address.trim().split("\\.", -1);
        if (parts.length != 4) {
            throw new DomainException("invalid IPv4 address: " + address);
        }
        int[] octets = new int[4];
        for (int i = 0; i < 4; i++) {
            String part = parts[i];
            if (part.isEmpty() || part.length() > 3 || !part.chars().allMatch(Character::isDigit)
                    || (part.length() > 1 && part.charAt(0) == '0')) {
                throw new DomainException("invalid IPv4 address: " + address);
            }
            octets[i] = Integer.parseInt(part);
            if (octets[i] > 255) {
                throw new DomainException("invalid IPv4 address: " + address);
            }
        }
        return octets;
    }

    static int parsePrefix(String s) {
        String digits = s.startsWith("/") ? s.substring(1) : s;
        if (digits.isEmpty() || digits.length() > 2 || !digits.chars().allMatch(Character::isDigit)) {
            throw new DomainException("invalid prefix: " + s);
        }
        int prefix = Integer.parseInt(digits);
        checkPrefix(prefix);
        return prefix;
    }

    private static void checkPrefix(int prefix) {
        if (prefix < 0 || prefix > 32) {
            throw new DomainException("invalid prefix length: " + prefix);
        }
    }

    static int[] maskOctets(int prefix) {
        checkPrefix(prefix);
        long bits = prefix == 0 ? 0 : (0xFFFFFFFFL << (32 - prefix)) & 0xFFFFFFFFL;
        return new int[]{
                (int) (bits >> 24) & 0xFF,
                (int) (bits >> 16) & 0xFF,
                (int) (bits >> 8) & 0xFF,
                (int) bits & 0xFF
        };
    }

    private static int[] applyMask(int[] ip, int[] mask) {
        int[] out = new int[4];
        for (int i = 0; i < 4; i++) {
            out[i] = ip[i] & mask[i];
        }
        return out;
    }

    private static long toLong(int[] octets) {
        return ((long) octets[0] << 24) | ((long) octets[1] << 16) | ((long) octets[2] << 8) | octets[3];
    }

    private static int ceilLog2(long n) {
        return n <= 1 ? 0 : 64 - Long.numberOfLeadingZeros(n - 1);
    }

    static String format(int[] octets) {
        return octets[0] + "." + octets[1] + "." + octets[2] + "." + octets[3];
    }
}
