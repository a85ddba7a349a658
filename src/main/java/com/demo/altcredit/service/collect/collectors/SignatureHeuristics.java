package com.demo.altcredit.service.collect.collectors;

import java.util.ArrayList;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Locale;
import java.util.Set;

/**
 * Infers payment and subscription usage from storage keys and cookie text. Results are
 * guesses and must be stored as heuristic fields.
 */
final class SignatureHeuristics {
    private SignatureHeuristics() {}

    static final List<String> WALLET_SIGNATURES = List.of("paytm", "phonepe", "gpay", "amazonpay", "wallet");

    private static final List<ServicePattern> SERVICES = List.of(
            new ServicePattern("netflix", List.of("netflix.com", "nflximg", "nflxvideo"), List.of("netflix")),
            new ServicePattern("spotify", List.of("spotify.com", "scdn.co"), List.of("spotify", "sp_")),
            new ServicePattern("amazon_prime", List.of("primevideo", "amazon.com", "amazon.in"), List.of("primevideo")),
            new ServicePattern("hotstar", List.of("hotstar"), List.of("hotstar")),
            new ServicePattern("youtube_premium", List.of("youtube"), List.of("pref", "visitor_info"))
    );

    static List<String> paymentMethods(Set<String> storageKeys, String cookies,
                                       boolean paymentRequestSupported, boolean mobile) {
        Set<String> out = new LinkedHashSet<>();
        if (paymentRequestSupported) {
            out.add("debit_card");
            out.add("credit_card");
        }
        if (mobile) out.add("upi");
        String c = lower(cookies);
        for (String sig : WALLET_SIGNATURES) {
            if (c.contains(sig) || storageKeys.stream().anyMatch(k -> lower(k).contains(sig))) {
                out.add("wallet");
                break;
            }
        }
        return new ArrayList<>(out);
    }

    static List<String> subscriptionServices(Set<String> storageKeys, String cookies) {
        String c = lower(cookies);
        List<String> out = new ArrayList<>();
        for (ServicePattern p : SERVICES) {
            boolean hit = p.cookies.stream().anyMatch(c::contains)
                    || storageKeys.stream().map(SignatureHeuristics::lower)
                        .anyMatch(k -> p.domains.stream().anyMatch(k::contains));
            if (hit) out.add(p.name);
        }
        return out;
    }

    private static String lower(String s) {
        return s == null ? "" : s.toLowerCase(Locale.ROOT);
    }

    private record ServicePattern(String name, List<String> domains, List<String> cookies) {}
}
