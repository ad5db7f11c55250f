package com.microsoft.azure.kusto.core.ingest.resources;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertSame;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;

import java.util.HashSet;
import java.util.List;
import java.util.Random;
import java.util.Set;
import java.util.stream.Collectors;

import org.junit.jupiter.api.Test;

import com.microsoft.azure.kusto.core.ingest.MockTimeProvider;
import com.microsoft.azure.kusto.core.ingest.utils.DefaultRandomProvider;
import com.microsoft.azure.kusto.core.ingest.utils.RandomProvider;

class RankedStorageAccountSetTest {

    static class ByNameReverseOrderRandomProvider implements RandomProvider {
        @Override
        public void shuffle(List<?> list) {
            list.sort((o1, o2) -> ((RankedStorageAccount) o2).getAccountName().compareTo(((RankedStorageAccount) o1).getAccountName()));
        }
    }

    private static RankedStorageAccountSet newSet(int[] tiers, RandomProvider randomProvider) {
        return new RankedStorageAccountSet(6, 10_000, tiers, new MockTimeProvider(System.currentTimeMillis()), randomProvider);
    }

    private static void logPercentage(RankedStorageAccountSet set, String name, int successPercentage) {
        set.registerStorageAccount(name);
        for (int j = 0; j < 100; j++) {
            set.logResultToAccount(name, j < successPercentage);
        }
    }

    @Test
    void testShuffledAccountsNoTiers() {
        RankedStorageAccountSet set = newSet(new int[] {0}, new ByNameReverseOrderRandomProvider());

        set.registerStorageAccount("aSuccessful");
        set.registerStorageAccount("bFailed");
        set.registerStorageAccount("cHalf");

        set.logResultToAccount("aSuccessful", true);
        set.logResultToAccount("bFailed", false);
        set.logResultToAccount("cHalf", true);
        set.logResultToAccount("cHalf", false);

        List<RankedStorageAccount> accounts = set.getRankedShuffledAccounts();
        assertEquals("cHalf", accounts.get(0).getAccountName());
        assertEquals("bFailed", accounts.get(1).getAccountName());
        assertEquals("aSuccessful", accounts.get(2).getAccountName());
    }

    @Test
    void testShuffledAccounts() {
        RankedStorageAccountSet set = newSet(new int[] {90, 70, 30, 0}, new ByNameReverseOrderRandomProvider());

        int[] values = new int[] {95, 40, 80, 20, 97, 10, 50, 75, 29, 0};
        for (int i = 0; i < values.length; i++) {
            logPercentage(set, String.format("%s%d", (char) ('a' + i), values[i]), values[i]);
        }

        String[][] expected = new String[][] {
                {"e97", "a95"},
                {"h75", "c80"},
                {"g50", "b40"},
                {"j0", "i29", "f10", "d20"}
        };

        List<RankedStorageAccount> accounts = set.getRankedShuffledAccounts();
        int total = 0;
        for (String[] strings : expected) {
            for (int j = 0; j < strings.length; j++) {
                assertEquals(strings[j], accounts.get(total + j).getAccountName());
            }
            total += strings.length;
        }
        assertEquals(total, accounts.size());
    }

    @Test
    void testShuffledAccountsEmptyTier() {
        RankedStorageAccountSet set = newSet(new int[] {90, 70, 30, 0}, new ByNameReverseOrderRandomProvider());

        int[] values = new int[] {95, 40, 20, 97, 10, 50};
        for (int i = 0; i < values.length; i++) {
            logPercentage(set, String.format("%s%d", (char) ('a' + i), values[i]), values[i]);
        }

        List<String> names = set.getRankedShuffledAccounts().stream().map(RankedStorageAccount::getAccountName).collect(Collectors.toList());
        assertEquals(List.of("d97", "a95", "f50", "b40", "e10", "c20"), names);
    }

    @Test
    void testRandomShuffleKeepsTiersAndEveryAccount() {
        RankedStorageAccountSet set = newSet(new int[] {90, 70, 30, 0}, new DefaultRandomProvider(new Random(42)));
        int[] values = new int[] {95, 40, 80, 20, 97, 10, 50, 75, 29, 0, 100, 65};
        for (int i = 0; i < values.length; i++) {
            logPercentage(set, "account" + i, values[i]);
        }

        for (int round = 0; round < 20; round++) {
            List<RankedStorageAccount> accounts = set.getRankedShuffledAccounts();
            assertEquals(values.length, accounts.size());
            Set<String> names = accounts.stream().map(RankedStorageAccount::getAccountName).collect(Collectors.toSet());
            assertEquals(set.getAccountNames(), names);

            for (int i = 1; i < accounts.size(); i++) {
                assertTrue(tierOf(accounts.get(i - 1)) <= tierOf(accounts.get(i)), "a lower tier came before a higher one");
            }
        }
    }

    private static int tierOf(RankedStorageAccount account) {
        double rank = account.getRank() * 100;
        return rank >= 90 ? 0 : rank >= 70 ? 1 : rank >= 30 ? 2 : 3;
    }

    @Test
    void testRegisterIsIdempotentAndKeepsStatistics() {
        RankedStorageAccountSet set = newSet(new int[] {90, 70, 30, 0}, new ByNameReverseOrderRandomProvider());
        set.registerStorageAccount("account");
        RankedStorageAccount account = set.getStorageAccount("account");
        set.logResultToAccount("account", false);

        set.registerStorageAccount("account");

        assertEquals(1, set.size());
        assertSame(account, set.getStorageAccount("account"));
        assertEquals(0.0, set.getStorageAccount("account").getRank(), 0.001);
    }

    @Test
    void testUnknownAccountIsRejected() {
        RankedStorageAccountSet set = new RankedStorageAccountSet();
        set.registerStorageAccount("known");

        IllegalArgumentException logError = assertThrows(IllegalArgumentException.class, () -> set.logResultToAccount("unknown", true));
        assertTrue(logError.getMessage().contains("unknown"));
        assertThrows(IllegalArgumentException.class, () -> set.getStorageAccount("unknown"));
        assertEquals(new HashSet<>(List.of("known")), set.getAccountNames());
    }

    @Test
    void testTiersMustBeDescending() {
        assertThrows(IllegalArgumentException.class, () -> newSet(new int[] {30, 70}, new ByNameReverseOrderRandomProvider()));
        assertThrows(IllegalArgumentException.class, () -> newSet(new int[0], new ByNameReverseOrderRandomProvider()));
    }

    @Test
    void testBucketSettingsMustBePositive() {
        MockTimeProvider timeProvider = new MockTimeProvider(System.currentTimeMillis());
        RandomProvider randomProvider = new DefaultRandomProvider(new Random(1));
        int[] tiers = new int[] {90, 70, 30, 0};

        assertThrows(IllegalArgumentException.class, () -> new RankedStorageAccountSet(0, 10_000, tiers, timeProvider, randomProvider));
        assertThrows(IllegalArgumentException.class, () -> new RankedStorageAccountSet(-1, 10_000, tiers, timeProvider, randomProvider));
        assertThrows(IllegalArgumentException.class, () -> new RankedStorageAccountSet(6, 0, tiers, timeProvider, randomProvider));
    }
}
