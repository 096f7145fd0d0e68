package com.linecalc.app.evaluators;

import com.linecalc.app.models.SubnetInfo;

import java.util.List;
import java.util.Locale;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

/**
 * IPv4 / CIDR phrasings: subnet splitting, host counts, masks,
 * containment, neighbouring subnets and plain "a.b.c.d/n" lookups.
 */
public class NetworkEvaluator extends HandlerChainEvaluator {

    private static final String IP = "\\d{1,3}\\.\\d{1,3}\\.\\d{1,3}\\.\\d{1,3}";
    private static final String CIDR = IP + "/\\d{1,2}";

    private static final Pattern IP_PATTERN = Pattern.compile(IP);
    private static final Pattern CIDR_PATTERN = Pattern.compile(CIDR);
    private static final Pattern SLASH_PREFIX = Pattern.compile("/\\d{1,2}");

    private static final Pattern SPLIT_TO_SUBNETS = Pattern.compile(
            "(?:split|divide)\\s+(" + CIDR + ")\\s+(?:to|into)\\s+(\\d{1,9})\\s+subnets?");
    private static final Pattern SPLIT_BY_HOSTS = Pattern.compile(
            "(?:split|divide)\\s+(" + CIDR + ")\\s+(?:to|into)\\s+subnets?\\s+(?:with|of)\\s+(\\d{1,9})\\s+hosts?");
    private static final Pattern HOST_COUNT = Pattern.compile(
            "(?:how\\s+many\\s+)?hosts?\\s+(?:in|for|count)?\\s*(" + CIDR + ")");
    private static final Pattern HOST_COUNT_PREFIX = Pattern.compile(
            "(?:how\\s+many\\s+)?hosts?\\s+(?:in|for)?\\s*/(\\d{1,2})");
    private static final Pattern SUBNET_INFO = Pattern.compile(
            "(?:subnet\\s+)?info\\s+(?:for\\s+)?(" + CIDR + ")");
    private static final Pattern WILDCARD = Pattern.compile(
            "wildcard\\s+(?:mask\\s+)?(?:for\\s+)?/?(\\d{1,2})");
    private static final Pattern MASK_FOR = Pattern.compile(
            "(?:subnet\\s+)?(?:net)?mask\\s+(?:for\\s+)?/?(\\d{1,2})");
    private static final Pattern PREFIX_FROM_MASK = Pattern.compile(
            "(?:prefix|cidr)\\s+(?:for\\s+)?(" + IP + ")");
    private static final Pattern IP_IN_RANGE = Pattern.compile(
            "is\\s+(" + IP + ")\\s+in\\s+(" + CIDR + ")");
    private static final Pattern NEXT_SUBNET = Pattern.compile(
            "next\\s+subnet\\s+(?:after\\s+)?(" + CIDR + ")");
    private static final Pattern BROADCAST = Pattern.compile(
            "broadcast\\s+(?:for|of|address)?\\s*(" + CIDR + ")");
    private static final Pattern NETWORK_ADDRESS = Pattern.compile(
            "network\\s+(?:for|of|address)?\\s*(" + CIDR + ")");
    private static final Pattern JUST_CIDR = Pattern.compile("^(" + CIDR + ")$");

    private static final List<String> KEYWORDS = List.of(
            "subnet", "cidr", "netmask", "wildcard", "broadcast", "split");

    // "wildcard mask" must precede "mask for"; split phrasings precede host counts
    private final List<Handler> chain = List.of(
            this::splitToSubnets,
            this::splitByHosts,
            this::hostCount,
            this::subnetInfo,
            this::wildcardMask,
            this::maskForPrefix,
            this::prefixFromMask,
            this::ipInRange,
            this::nextSubnet,
            this::broadcast,
            this::networkAddress,
            this::justCidr
    );

    public NetworkEvaluator() {
        super("network");
    }

    @Override
    protected List<Handler> handlers() {
        return chain;
    }

    @Override
    public boolean accepts(String expr) {
        if (CIDR_PATTERN.matcher(expr).find()) {
            return true;
        }
        String lower = expr.toLowerCase(Locale.ROOT);
        for (String keyword : KEYWORDS) {
            if (lower.contains(keyword)) {
                return true;
            }
        }
        if (lower.contains("hosts")) {
            return IP_PATTERN.matcher(expr).find() || SLASH_PREFIX.matcher(expr).find();
        }
        if (lower.contains("mask") && lower.contains("/")) {
            return true;
        }
        if (lower.contains("prefix for") || lower.contains("cidr for")) {
            return IP_PATTERN.matcher(expr).find();
        }
        return false;
    }

    HandlerResult splitToSubnets(String expr, String lower) {
        Matcher m = SPLIT_TO_SUBNETS.matcher(lower);
        if (!m.find()) {
            return HandlerResult.notMine();
        }
        int count = Integer.parseInt(m.group(2));
        return HandlerResult.claimed(SubnetCalculator.formatSubnetList(
                SubnetCalculator.splitToSubnets(m.group(1), count)));
    }

    HandlerResult splitByHosts(String expr, String lower) {
        Matcher m = SPLIT_BY_HOSTS.matcher(lower);
        if (!m.find()) {
            return HandlerResult.notMine();
        }
        int hosts = Integer.parseInt(m.group(2));
        return HandlerResult.claimed(SubnetCalculator.formatSubnetList(
                SubnetCalculator.splitByHostCount(m.group(1), hosts)));
    }

    HandlerResult hostCount(String expr, String lower) {
        Matcher m = HOST_COUNT.matcher(lower);
        if (m.find()) {
            long hosts = SubnetCalculator.parseCidr(m.group(1)).getHostCount();
            return HandlerResult.claimed(hosts + " hosts", hosts);
        }
        m = HOST_COUNT_PREFIX.matcher(lower);
        if (m.find()) {
            long hosts = SubnetCalculator.hostsInPrefix(Integer.parseInt(m.group(1)));
            return HandlerResult.claimed(hosts + " hosts", hosts);
        }
        return HandlerResult.notMine();
    }

    HandlerResult subnetInfo(String expr, String lower) {
        Matcher m = SUBNET_INFO.matcher(lower);
        if (!m.find()) {
            return HandlerResult.notMine();
        }
        return HandlerResult.claimed(SubnetCalculator.formatSubnetInfo(SubnetCalculator.parseCidr(m.group(1))));
    }

    HandlerResult wildcardMask(String expr, String lower) {
        Matcher m = WILDCARD.matcher(lower);
        if (!m.find()) {
            return HandlerResult.notMine();
        }
        return HandlerResult.claimed(SubnetCalculator.wildcardMask(SubnetCalculator.parsePrefix(m.group(1))));
    }

    HandlerResult maskForPrefix(String expr, String lower) {
        Matcher m = MASK_FOR.matcher(lower);
        if (!m.find()) {
            return HandlerResult.notMine();
        }
        return HandlerResult.claimed(SubnetCalculator.calculateMask(SubnetCalculator.parsePrefix(m.group(1))));
    }

    HandlerResult prefixFromMask(String expr, String lower) {
        Matcher m = PREFIX_FROM_MASK.matcher(lower);
        if (!m.find()) {
            return HandlerResult.notMine();
        }
        return HandlerResult.claimed("/" + SubnetCalculator.prefixFromMask(m.group(1)));
    }

    HandlerResult ipInRange(String expr, String lower) {
        Matcher m = IP_IN_RANGE.matcher(lower);
        if (!m.find()) {
            return HandlerResult.notMine();
        }
        return HandlerResult.claimed(SubnetCalculator.contains(m.group(2), m.group(1)) ? "yes" : "no");
    }

    HandlerResult nextSubnet(String expr, String lower) {
        Matcher m = NEXT_SUBNET.matcher(lower);
        if (!m.find()) {
            return HandlerResult.notMine();
        }
        return HandlerResult.claimed(SubnetCalculator.nextSubnet(m.group(1)));
    }

    HandlerResult broadcast(String expr, String lower) {
        Matcher m = BROADCAST.matcher(lower);
        if (!m.find()) {
            return HandlerResult.notMine();
        }
        return HandlerResult.claimed(SubnetCalculator.parseCidr(m.group(1)).getBroadcast());
    }

    HandlerResult networkAddress(String expr, String lower) {
        Matcher m = NETWORK_ADDRESS.matcher(lower);
        if (!m.find()) {
            return HandlerResult.notMine();
        }
        return HandlerResult.claimed(SubnetCalculator.parseCidr(m.group(1)).getCidr());
    }

    HandlerResult justCidr(String expr, String lower) {
        Matcher m = JUST_CIDR.matcher(expr.trim());
        if (!m.matches()) {
            return HandlerResult.notMine();
        }
        SubnetInfo info = SubnetCalculator.parseCidr(m.group(1));
        return HandlerResult.claimed(SubnetCalculator.formatSubnetInfo(info));
    }
}
