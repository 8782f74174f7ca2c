package com.propertyprice.map.domain.service;

import com.propertyprice.map.domain.model.CorrelationVariable;
import com.propertyprice.map.domain.model.CountyComparison;
import com.propertyprice.map.domain.model.CountyPrice;
import com.propertyprice.map.domain.model.CountySummary;
import com.propertyprice.map.domain.model.PriceCorrelation;
import com.propertyprice.map.domain.model.PriceTrend;
import com.propertyprice.map.domain.model.SaleObservation;
import com.propertyprice.map.domain.model.TrendPeriod;
import org.apache.commons.math3.distribution.TDistribution;
import org.apache.commons.math3.stat.correlation.PearsonsCorrelation;
import org.apache.commons.math3.stat.descriptive.DescriptiveStatistics;
import org.springframework.stereotype.Service;

import java.time.ZoneOffset;
import java.util.ArrayList;
import java.util.Collection;
import java.util.Comparator;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.TreeMap;

/**
 * Descriptive statistics over recorded sales: price trends per calendar period,
 * county comparison and price correlation.
 */
@Service
public class PriceStatisticsCalculator {

    static final double SMALL_BAND_SIZE = 19.0;
    static final double MEDIUM_BAND_SIZE = 81.5;
    static final double LARGE_BAND_SIZE = 150.0;

    /**
     * Group sales by period. Periods without sales are absent; the result is
     * ordered oldest period first.
     */
    public List<PriceTrend> priceTrends(Collection<SaleObservation> sales, TrendPeriod period) {
        Map<String, DescriptiveStatistics> byPeriod = new TreeMap<>();
        for (SaleObservation sale : sales) {
            byPeriod.computeIfAbsent(period.labelOf(sale.getDateOfSale()), label -> new DescriptiveStatistics())
                    .addValue(sale.getPrice());
        }
        List<PriceTrend> trends = new ArrayList<>(byPeriod.size());
        byPeriod.forEach((label, stats) -> trends.add(new PriceTrend(
                label,
                stats.getMean(),
                stats.getPercentile(50),
                stats.getN() > 1 ? stats.getStandardDeviation() : 0.0,
                (long) stats.getMin(),
                (long) stats.getMax(),
                (int) stats.getN())));
        return trends;
    }

    /**
     * Summarise the latest price of each property per county. With no prices the
     * overall figures are 0.
     */
    public CountyComparison countyComparison(Collection<CountyPrice> latestPrices) {
        Map<String, DescriptiveStatistics> byCounty = new LinkedHashMap<>();
        DescriptiveStatistics overall = new DescriptiveStatistics();
        for (CountyPrice latest : latestPrices) {
            byCounty.computeIfAbsent(latest.getCounty(), county -> new DescriptiveStatistics())
                    .addValue(latest.getPrice());
            overall.addValue(latest.getPrice());
        }
        List<CountySummary> summaries = new ArrayList<>(byCounty.size());
        byCounty.forEach((county, stats) -> summaries.add(new CountySummary(
                county,
                (int) stats.getN(),
                stats.getMean(),
                stats.getPercentile(50),
                (long) stats.getMin(),
                (long) stats.getMax())));
        summaries.sort(Comparator.comparingDouble(CountySummary::getAveragePrice).reversed()
                .thenComparing(CountySummary::getCounty));
        if (overall.getN() == 0) {
            return new CountyComparison(summaries, 0.0, 0.0);
        }
        return new CountyComparison(summaries, overall.getMean(), overall.getPercentile(50));
    }

    /**
     * Pearson correlation of price against the variable. Sales whose variable
     * cannot be derived are left out.
     */
    public PriceCorrelation correlation(Collection<SaleObservation> sales, CorrelationVariable variable) {
        if (sales.size() < 2) {
            return new PriceCorrelation(0.0, 1.0, 0, PriceCorrelation.INSUFFICIENT_DATA);
        }
        List<double[]> pairs = new ArrayList<>(sales.size());
        for (SaleObservation sale : sales) {
            double x = variableOf(sale, variable);
            if (!Double.isNaN(x)) {
                pairs.add(new double[] {x, sale.getPrice()});
            }
        }
        int n = pairs.size();
        if (n < 2) {
            return new PriceCorrelation(0.0, 1.0, n, PriceCorrelation.INSUFFICIENT_VALID_DATA);
        }
        double[] x = new double[n];
        double[] y = new double[n];
        for (int i = 0; i < n; i++) {
            x[i] = pairs.get(i)[0];
            y[i] = pairs.get(i)[1];
        }
        double r = new PearsonsCorrelation().correlation(x, y);
        // Constant input has no defined correlation
        if (Double.isNaN(r)) {
            return new PriceCorrelation(0.0, 1.0, n, interpret(0.0));
        }
        return new PriceCorrelation(r, pValue(r, n), n, interpret(r));
    }

    /**
     * Representative floor area in square metres for a size description, or NaN
     * when the description names no known band.
     */
    static double sizeOf(String description) {
        if (description == null) {
            return Double.NaN;
        }
        String lower = description.toLowerCase(Locale.ROOT);
        if (description.contains("38") && description.contains("125")) {
            return MEDIUM_BAND_SIZE;
        }
        if (lower.contains("less than 38")) {
            return SMALL_BAND_SIZE;
        }
        if (lower.contains("greater than 125") || description.contains("125")) {
            return LARGE_BAND_SIZE;
        }
        return Double.NaN;
    }

    static String interpret(double r) {
        double strength = Math.abs(r);
        if (strength < 0.1) {
            return "Negligible correlation";
        } else if (strength < 0.3) {
            return "Weak correlation";
        } else if (strength < 0.5) {
            return "Moderate correlation";
        } else if (strength < 0.7) {
            return "Strong correlation";
        }
        return "Very strong correlation";
    }

    // Two-sided, from Student's t with n - 2 degrees of freedom
    static double pValue(double r, int n) {
        if (n < 3) {
            return 1.0;
        }
        double rSquared = r * r;
        if (rSquared >= 1.0) {
            return 0.0;
        }
        double t = Math.abs(r) * Math.sqrt((n - 2) / (1.0 - rSquared));
        TDistribution distribution = new TDistribution(n - 2);
        return Math.min(1.0, 2.0 * (1.0 - distribution.cumulativeProbability(t)));
    }

    private static double variableOf(SaleObservation sale, CorrelationVariable variable) {
        if (variable == CorrelationVariable.DATE) {
            return sale.getDateOfSale().atStartOfDay(ZoneOffset.UTC).toEpochSecond();
        }
        return sizeOf(sale.getDescription());
    }
}
