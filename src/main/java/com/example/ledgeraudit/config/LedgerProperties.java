package com.example.ledgeraudit.config;

import com.example.ledgeraudit.domain.model.GroupingRule;
import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.boot.context.properties.bind.ConstructorBinding;

import java.nio.file.Path;
import java.time.Duration;
import java.util.List;
import java.util.Map;
import java.util.regex.Pattern;
import java.util.regex.PatternSyntaxException;

/**
 * Tunables of the extraction and verification pipeline, bound from {@code ledger.*}.
 * Every section is optional; absent values fall back to the defaults below.
 */
@ConfigurationProperties(prefix = "ledger")
public record LedgerProperties(
        Segmentation segmentation,
        Parsing parsing,
        Validation validation,
        Reconciliation reconciliation,
        Aggregation aggregation,
        Verification verification,
        Pipeline pipeline,
        Reference reference,
        Audit audit,
        Ocr ocr
) {

    @ConstructorBinding
    public LedgerProperties {
        segmentation = segmentation != null ? segmentation : new Segmentation(null, null, null, null);
        parsing = parsing != null ? parsing : new Parsing(null, null, null, null, null, null);
        validation = validation != null ? validation : new Validation(null, null, null);
        reconciliation = reconciliation != null ? reconciliation : new Reconciliation(null);
        aggregation = aggregation != null ? aggregation : new Aggregation(null);
        verification = verification != null ? verification : new Verification(null);
        pipeline = pipeline != null ? pipeline : new Pipeline(null, null, null, null);
        reference = reference != null ? reference : new Reference(null, null, null);
        audit = audit != null ? audit : new Audit(null, null);
        ocr = ocr != null ? ocr : new Ocr(null);
    }

    public static LedgerProperties defaults() {
        return new LedgerProperties(null, null, null, null, null, null, null, null, null, null);
    }

    /**
     * @param rowGap                   max vertical distance (points) between fragments of one physical line
     * @param columnBinWidth           width of the x-offset histogram bins used to find column starts
     * @param minColumnSupport         fraction of a page's lines that must start text in a bin for it to count as a column
     * @param degradedConfidenceFactor multiplier applied to row confidence on pages without detected columns
     */
    public record Segmentation(Double rowGap, Double columnBinWidth, Double minColumnSupport, Double degradedConfidenceFactor) {
        public Segmentation {
            rowGap = positiveOr(rowGap, 6.0, "rowGap");
            columnBinWidth = positiveOr(columnBinWidth, 12.0, "columnBinWidth");
            minColumnSupport = fractionOr(minColumnSupport, 0.2, "minColumnSupport");
            degradedConfidenceFactor = fractionOr(degradedConfidenceFactor, 0.5, "degradedConfidenceFactor");
        }
    }

    public record Parsing(
            String warrantNumberPattern,
            String accountCodePattern,
            List<String> headerKeywords,
            List<String> footerKeywords,
            List<String> voidKeywords,
            Boolean carryForwardDates
    ) {
        public Parsing {
            warrantNumberPattern = patternOr(warrantNumberPattern, "(?:020\\d{7}|120\\d{7}|DDP-\\d{8})", "warrantNumberPattern");
            accountCodePattern = patternOr(accountCodePattern, "\\d{2}-\\d{4}", "accountCodePattern");
            headerKeywords = headerKeywords != null ? List.copyOf(headerKeywords) : List.of(
                    "Pay to the Order", "Fd-Objt", "Checks Dated", "ReqPay12a", "Board Report",
                    "Vendor Name", "Check Number", "Warrant Number");
            footerKeywords = footerKeywords != null ? List.copyOf(footerKeywords) : List.of(
                    "preceding Checks", "Board of Trustees", "Total Number", "Fund Recap",
                    "Cancel/Reissue", "Net Issue", "Generated for", "Grand Total", "Sum of");
            voidKeywords = voidKeywords != null ? List.copyOf(voidKeywords) : List.of("CANCELLED", "CANCEL", "VOID");
            carryForwardDates = carryForwardDates != null && carryForwardDates;
        }

        public Pattern warrantNumberRegex() {
            return Pattern.compile(warrantNumberPattern);
        }

        public Pattern accountCodeRegex() {
            return Pattern.compile(accountCodePattern);
        }
    }

    /**
     * @param fiscalYearToleranceDays days a transaction date may fall outside its fiscal year before rejection
     * @param highConfidenceThreshold minimum row confidence for HIGH provenance
     * @param lowConfidenceThreshold  row confidence below which provenance is LOW
     */
    public record Validation(Integer fiscalYearToleranceDays, Double highConfidenceThreshold, Double lowConfidenceThreshold) {
        public Validation {
            fiscalYearToleranceDays = nonNegativeOr(fiscalYearToleranceDays, 0, "fiscalYearToleranceDays");
            highConfidenceThreshold = fractionOr(highConfidenceThreshold, 0.90, "highConfidenceThreshold");
            lowConfidenceThreshold = fractionOr(lowConfidenceThreshold, 0.60, "lowConfidenceThreshold");
            if (lowConfidenceThreshold > highConfidenceThreshold) {
                throw new IllegalArgumentException("lowConfidenceThreshold must not exceed highConfidenceThreshold");
            }
        }
    }

    public record Reconciliation(Integer fuzzyDateWindowDays) {
        public Reconciliation {
            fuzzyDateWindowDays = nonNegativeOr(fuzzyDateWindowDays, 3, "fuzzyDateWindowDays");
        }
    }

    public record Aggregation(List<GroupingRule> groupingRules) {
        public Aggregation {
            groupingRules = groupingRules != null && !groupingRules.isEmpty()
                    ? groupingRules.stream().distinct().sorted().toList()
                    : List.of(GroupingRule.PAYEE, GroupingRule.PAYEE_FISCAL_YEAR, GroupingRule.ACCOUNT_CATEGORY,
                    GroupingRule.FISCAL_YEAR, GroupingRule.FISCAL_MONTH);
        }
    }

    /**
     * @param controlTotalTolerancePercent allowed deviation between a stated control total and the ledger
     */
    public record Verification(Double controlTotalTolerancePercent) {
        public Verification {
            controlTotalTolerancePercent = controlTotalTolerancePercent != null ? controlTotalTolerancePercent : 2.0;
            if (controlTotalTolerancePercent < 0) {
                throw new IllegalArgumentException("controlTotalTolerancePercent must not be negative");
            }
        }
    }

    /**
     * @param workerThreads       size of the per-document worker pool
     * @param acquisitionAttempts total attempts for page-text acquisition, including the first
     * @param retryBackoff        delay between acquisition attempts, doubled on every retry
     * @param documentTimeout     upper bound on one document's processing
     */
    public record Pipeline(Integer workerThreads, Integer acquisitionAttempts, Duration retryBackoff, Duration documentTimeout) {
        public Pipeline {
            workerThreads = workerThreads != null ? workerThreads : 4;
            if (workerThreads < 1) {
                throw new IllegalArgumentException("workerThreads must be positive");
            }
            acquisitionAttempts = acquisitionAttempts != null ? acquisitionAttempts : 3;
            if (acquisitionAttempts < 1) {
                throw new IllegalArgumentException("acquisitionAttempts must be positive");
            }
            retryBackoff = retryBackoff != null ? retryBackoff : Duration.ofMillis(200);
            documentTimeout = documentTimeout != null ? documentTimeout : Duration.ofMinutes(2);
            if (retryBackoff.isNegative() || documentTimeout.isNegative() || documentTimeout.isZero()) {
                throw new IllegalArgumentException("retryBackoff must not be negative and documentTimeout must be positive");
            }
        }
    }

    /**
     * @param accountCodes          resource location of the account-code CSV
     * @param objectCategories      object-code leading digit to category name
     * @param fiscalYearStartMonth  first month of the fiscal year
     */
    public record Reference(String accountCodes, Map<String, String> objectCategories, Integer fiscalYearStartMonth) {
        public Reference {
            accountCodes = accountCodes != null && !accountCodes.isBlank() ? accountCodes : "classpath:reference/account-codes.csv";
            objectCategories = objectCategories != null && !objectCategories.isEmpty() ? Map.copyOf(objectCategories) : Map.of(
                    "1", "Certificated Salaries",
                    "2", "Classified Salaries",
                    "3", "Employee Benefits",
                    "4", "Books and Supplies",
                    "5", "Services & Operating",
                    "6", "Capital Outlay",
                    "7", "Other Outgo",
                    "8", "Revenue",
                    "9", "Fund Balance");
            fiscalYearStartMonth = fiscalYearStartMonth != null ? fiscalYearStartMonth : 7;
            if (fiscalYearStartMonth < 1 || fiscalYearStartMonth > 12) {
                throw new IllegalArgumentException("fiscalYearStartMonth must be between 1 and 12");
            }
        }
    }

    public record Audit(String logPath, Boolean enabled) {
        public Audit {
            logPath = logPath != null && !logPath.isBlank() ? logPath : "target/verification-audit.jsonl";
            enabled = enabled == null || enabled;
        }
    }

    /**
     * @param baseDir directory that every requested OCR JSON path must resolve into
     */
    public record Ocr(String baseDir) {
        public Ocr {
            baseDir = baseDir != null && !baseDir.isBlank() ? baseDir : "data/ocr";
        }

        public Path baseDirectory() {
            return Path.of(baseDir).toAbsolutePath().normalize();
        }
    }

    private static double positiveOr(Double value, double fallback, String name) {
        double resolved = value != null ? value : fallback;
        if (resolved <= 0) {
            throw new IllegalArgumentException(name + " must be positive");
        }
        return resolved;
    }

    private static double fractionOr(Double value, double fallback, String name) {
        double resolved = value != null ? value : fallback;
        if (resolved < 0 || resolved > 1) {
            throw new IllegalArgumentException(name + " must be between 0 and 1");
        }
        return resolved;
    }

    private static int nonNegativeOr(Integer value, int fallback, String name) {
        int resolved = value != null ? value : fallback;
        if (resolved < 0) {
            throw new IllegalArgumentException(name + " must not be negative");
        }
        return resolved;
    }

    private static String patternOr(String value, String fallback, String name) {
        String resolved = value != null && !value.isBlank() ? value : fallback;
        try {
            Pattern.compile(resolved);
        } catch (PatternSyntaxException ex) {
            throw new IllegalArgumentException(name + " is not a valid regular expression", ex);
        }
        return resolved;
    }
}
