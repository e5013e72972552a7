package com.finlens.backend.services.budget;

import java.math.BigDecimal;
import java.math.RoundingMode;
import java.time.DayOfWeek;
import java.time.LocalDate;
import java.time.YearMonth;
import java.time.temporal.ChronoUnit;
import java.util.ArrayList;
import java.util.Comparator;
import java.util.EnumMap;
import java.util.HashSet;
import java.util.LinkedHashMap;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Map;
import java.util.Set;
import java.util.TreeMap;

import org.springframework.stereotype.Service;

import com.finlens.backend.config.BudgetProperties;
import com.finlens.backend.dto.BudgetAlert;
import com.finlens.backend.dto.BudgetRecommendation;
import com.finlens.backend.dto.BudgetReport;
import com.finlens.backend.dto.CategorySpending;
import com.finlens.backend.dto.DateRange;
import com.finlens.backend.dto.SpendingAnalysis;
import com.finlens.backend.dto.Transaction;
import com.finlens.backend.enums.AlertSeverity;
import com.finlens.backend.enums.TransactionCategory;
import com.finlens.backend.services.currency.CurrencyDetector;
import com.finlens.backend.services.currency.CurrencyFormatter;

import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;

/**
 * Spending aggregates and income-relative budget recommendations. Amounts are summed as given; callers that
 * need a single currency convert the batch first.
 */
@Service
@RequiredArgsConstructor
@Slf4j
public class BudgetAnalysisService {

    static final String OVERALL = "overall";
    static final String SAVINGS = "savings";

    private static final BigDecimal ONE_HUNDRED = new BigDecimal("100");
    private static final int MONEY_SCALE = 2;
    private static final int PERCENT_SCALE = 2;
    private static final int DIVISION_SCALE = 6;
    private static final int TOP_MERCHANTS = 10;

    private final BudgetProperties budgetProperties;
    private final CurrencyDetector currencyDetector;

    public SpendingAnalysis analyzeSpending(List<Transaction> transactions) {
        List<Transaction> expenses = transactions.stream().filter(Transaction::isExpense).toList();
        List<Transaction> income = transactions.stream().filter(Transaction::isIncome).toList();

        BigDecimal totalExpenses = money(sumAbs(expenses));
        BigDecimal totalIncome = money(sumAbs(income));

        DateRange range = dateRange(transactions);
        BigDecimal averageDaily = range == null || range.days() <= 0
                ? money(BigDecimal.ZERO)
                : totalExpenses.divide(BigDecimal.valueOf(range.days()), MONEY_SCALE, RoundingMode.HALF_UP);

        Map<YearMonth, BigDecimal> monthly = new TreeMap<>();
        Map<DayOfWeek, BigDecimal> byDayOfWeek = new EnumMap<>(DayOfWeek.class);
        Map<String, BigDecimal> byMerchant = new LinkedHashMap<>();
        for (Transaction tx : expenses) {
            BigDecimal abs = tx.getAmount().abs();
            if (tx.getDate() != null) {
                monthly.merge(YearMonth.from(tx.getDate()), abs, BigDecimal::add);
                byDayOfWeek.merge(tx.getDate().getDayOfWeek(), abs, BigDecimal::add);
            }
            byMerchant.merge(tx.getDescription(), abs, BigDecimal::add);
        }
        monthly.replaceAll((k, v) -> money(v));
        byDayOfWeek.replaceAll((k, v) -> money(v));

        Map<String, BigDecimal> topMerchants = new LinkedHashMap<>();
        byMerchant.entrySet().stream()
                .sorted(Map.Entry.<String, BigDecimal>comparingByValue().reversed()
                        .thenComparing(Map.Entry.comparingByKey()))
                .limit(TOP_MERCHANTS)
                .forEach(e -> topMerchants.put(e.getKey(), money(e.getValue())));

        Set<String> currencies = new LinkedHashSet<>();
        for (Transaction tx : transactions) {
            if (tx.getCurrency() != null) currencies.add(tx.getCurrency());
        }

        return SpendingAnalysis.builder()
                .totalExpenses(totalExpenses)
                .totalIncome(totalIncome)
                .expenseCount(expenses.size())
                .averageDailyExpense(averageDaily)
                .categoryBreakdown(categoryBreakdown(expenses, totalExpenses))
                .monthlySpending(monthly)
                .dayOfWeekPattern(byDayOfWeek)
                .topMerchants(topMerchants)
                .dateRange(range)
                .currency(currencyDetector.electPrimary(transactions))
                .currenciesFound(List.copyOf(currencies))
                .build();
    }

    public BudgetReport recommend(List<Transaction> transactions) {
        String currency = currencyDetector.electPrimary(transactions);

        List<Transaction> income = transactions.stream().filter(Transaction::isIncome).toList();
        List<Transaction> expenses = transactions.stream().filter(Transaction::isExpense).toList();

        int incomeMonths = distinctMonths(income);
        if (incomeMonths == 0) {
            log.info("[BudgetAnalysis] no income rows; income-relative recommendations omitted");
            return new BudgetReport(null, currency, List.of(), List.of(), Map.of());
        }

        BigDecimal monthlyIncome = sumAbs(income).divide(BigDecimal.valueOf(incomeMonths), MONEY_SCALE, RoundingMode.HALF_UP);
        Map<TransactionCategory, BigDecimal> monthlySpend = averageMonthlySpendByCategory(expenses);

        List<BudgetRecommendation> recommendations = new ArrayList<>();
        List<BudgetAlert> alerts = new ArrayList<>();
        Map<TransactionCategory, BigDecimal> savingsPotential = new EnumMap<>(TransactionCategory.class);

        for (TransactionCategory category : TransactionCategory.values()) {
            BigDecimal recommended = money(monthlyIncome.multiply(budgetProperties.percentageFor(category)));
            BigDecimal current = monthlySpend.getOrDefault(category, money(BigDecimal.ZERO));
            AlertSeverity severity = severity(current, recommended);

            recommendations.add(new BudgetRecommendation(
                    category,
                    recommended,
                    current,
                    recommended.subtract(current),
                    percent(current, monthlyIncome),
                    severity));

            if (severity != null) {
                savingsPotential.put(category, current.subtract(recommended));
                alerts.add(new BudgetAlert(category.getCode(), categoryMessage(category, current, recommended, currency), severity));
            }
        }

        BigDecimal totalMonthlySpend = monthlySpend.values().stream().reduce(BigDecimal.ZERO, BigDecimal::add);
        BigDecimal overallLimit = monthlyIncome.multiply(budgetProperties.getOverallSpendRatio());
        if (totalMonthlySpend.compareTo(overallLimit) > 0) {
            alerts.add(new BudgetAlert(OVERALL, "Total monthly spending of " + CurrencyFormatter.format(totalMonthlySpend, currency)
                    + " is " + percent(totalMonthlySpend, monthlyIncome).stripTrailingZeros().toPlainString()
                    + "% of monthly income " + CurrencyFormatter.format(monthlyIncome, currency), AlertSeverity.HIGH));
        }

        BigDecimal savingsRate = monthlyIncome.subtract(totalMonthlySpend)
                .divide(monthlyIncome, DIVISION_SCALE, RoundingMode.HALF_UP);
        if (savingsRate.compareTo(budgetProperties.getSavingsTarget()) < 0) {
            alerts.add(new BudgetAlert(SAVINGS, "Savings rate is " + savingsRate.multiply(ONE_HUNDRED).setScale(PERCENT_SCALE, RoundingMode.HALF_UP).stripTrailingZeros().toPlainString()
                    + "%, below the " + budgetProperties.getSavingsTarget().multiply(ONE_HUNDRED).stripTrailingZeros().toPlainString()
                    + "% target", AlertSeverity.MEDIUM));
        }

        alerts.sort(Comparator.comparing(BudgetAlert::severity).thenComparing(BudgetAlert::category));

        log.info("[BudgetAnalysis] monthlyIncome={} {} incomeMonths={} alerts={}", monthlyIncome, currency, incomeMonths, alerts.size());
        return new BudgetReport(monthlyIncome, currency, recommendations, alerts, savingsPotential);
    }

    /**
     * Category total divided by the number of distinct months that have any expense.
     */
    private static Map<TransactionCategory, BigDecimal> averageMonthlySpendByCategory(List<Transaction> expenses) {
        int months = distinctMonths(expenses);
        Map<TransactionCategory, BigDecimal> totals = new EnumMap<>(TransactionCategory.class);
        for (Transaction tx : expenses) {
            TransactionCategory category = tx.getCategory() != null ? tx.getCategory() : TransactionCategory.OTHER;
            totals.merge(category, tx.getAmount().abs(), BigDecimal::add);
        }
        if (months == 0) return totals;

        Map<TransactionCategory, BigDecimal> averages = new EnumMap<>(TransactionCategory.class);
        for (Map.Entry<TransactionCategory, BigDecimal> e : totals.entrySet()) {
            averages.put(e.getKey(), e.getValue().divide(BigDecimal.valueOf(months), MONEY_SCALE, RoundingMode.HALF_UP));
        }
        return averages;
    }

    private AlertSeverity severity(BigDecimal current, BigDecimal recommended) {
        if (current.compareTo(recommended.multiply(budgetProperties.getHighSeverityRatio())) > 0) {
            return AlertSeverity.HIGH;
        }
        if (current.compareTo(recommended) > 0) {
            return AlertSeverity.MEDIUM;
        }
        return null;
    }

    private static String categoryMessage(TransactionCategory category, BigDecimal current, BigDecimal recommended, String currency) {
        String over = CurrencyFormatter.format(current.subtract(recommended), currency);
        return "Monthly " + category.getCode() + " spending of " + CurrencyFormatter.format(current, currency)
                + " exceeds the recommended " + CurrencyFormatter.format(recommended, currency) + " by " + over;
    }

    private static List<CategorySpending> categoryBreakdown(List<Transaction> expenses, BigDecimal totalExpenses) {
        Map<TransactionCategory, BigDecimal> totals = new EnumMap<>(TransactionCategory.class);
        Map<TransactionCategory, Integer> counts = new EnumMap<>(TransactionCategory.class);
        for (Transaction tx : expenses) {
            TransactionCategory category = tx.getCategory() != null ? tx.getCategory() : TransactionCategory.OTHER;
            totals.merge(category, tx.getAmount().abs(), BigDecimal::add);
            counts.merge(category, 1, Integer::sum);
        }

        List<CategorySpending> breakdown = new ArrayList<>();
        for (Map.Entry<TransactionCategory, BigDecimal> e : totals.entrySet()) {
            int count = counts.get(e.getKey());
            breakdown.add(new CategorySpending(
                    e.getKey(),
                    money(e.getValue()),
                    count,
                    e.getValue().divide(BigDecimal.valueOf(count), MONEY_SCALE, RoundingMode.HALF_UP),
                    percent(e.getValue(), totalExpenses)));
        }
        breakdown.sort(Comparator.comparing(CategorySpending::total).reversed()
                .thenComparing(CategorySpending::category));
        return breakdown;
    }

    private static DateRange dateRange(List<Transaction> transactions) {
        LocalDate start = null;
        LocalDate end = null;
        for (Transaction tx : transactions) {
            LocalDate d = tx.getDate();
            if (d == null) continue;
            if (start == null || d.isBefore(start)) start = d;
            if (end == null || d.isAfter(end)) end = d;
        }
        if (start == null) return null;
        return new DateRange(start, end, ChronoUnit.DAYS.between(start, end) + 1);
    }

    private static int distinctMonths(List<Transaction> transactions) {
        Set<YearMonth> months = new HashSet<>();
        for (Transaction tx : transactions) {
            if (tx.getDate() != null) months.add(YearMonth.from(tx.getDate()));
        }
        return months.size();
    }

    private static BigDecimal sumAbs(List<Transaction> transactions) {
        BigDecimal total = BigDecimal.ZERO;
        for (Transaction tx : transactions) {
            total = total.add(tx.getAmount().abs());
        }
        return total;
    }

    private static BigDecimal percent(BigDecimal part, BigDecimal whole) {
        if (whole == null || whole.signum() == 0) return BigDecimal.ZERO.setScale(PERCENT_SCALE);
        return part.multiply(ONE_HUNDRED).divide(whole, PERCENT_SCALE, RoundingMode.HALF_UP);
    }

    private static BigDecimal money(BigDecimal value) {
        return value.setScale(MONEY_SCALE, RoundingMode.HALF_UP);
    }
}
