package com.campus.reviews.moderation;

import com.campus.reviews.config.ModerationProperties;
import jakarta.annotation.PostConstruct;
import lombok.extern.slf4j.Slf4j;
import org.springframework.core.io.Resource;
import org.springframework.core.io.ResourceLoader;
import org.springframework.stereotype.Component;

import java.io.BufferedReader;
import java.io.IOException;
import java.io.InputStreamReader;
import java.io.UncheckedIOException;
import java.nio.charset.StandardCharsets;
import java.util.*;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

/**
 * Word-list and pattern based scorer. Pure once the lexicons are loaded.
 */
@Slf4j
@Component("lexiconRiskScorer")
public class LexiconRiskScorer implements RiskScorer {

    private static final Pattern TOKEN = Pattern.compile("[a-z']+");

    private static final List<Pattern> SPAM_PATTERNS = List.of(
            Pattern.compile("(.)\\1{4,}"),
            Pattern.compile("\\b(\\w+)\\s+\\1\\b", Pattern.CASE_INSENSITIVE),
            Pattern.compile("\\b(\\w+)(\\s+\\w+){0,2}\\s+\\1\\b", Pattern.CASE_INSENSITIVE),
            Pattern.compile("\\b(buy|purchase|discount|offer|deal|sale|cheap|free|money)\\b", Pattern.CASE_INSENSITIVE),
            Pattern.compile("\\b(click|visit|website|link|url|http|https|www)\\b", Pattern.CASE_INSENSITIVE),
            Pattern.compile("\\b(contact|email|phone|call|whatsapp|telegram)\\b", Pattern.CASE_INSENSITIVE),
            Pattern.compile("\\b(assignment|homework|exam|test|quiz)\\s+(help|service|solution)s?\\b", Pattern.CASE_INSENSITIVE),
            Pattern.compile("\\b(write|writing|paper|essay|thesis)\\s+(service|help)s?\\b", Pattern.CASE_INSENSITIVE),
            Pattern.compile("[A-Z]{3,}"),
            Pattern.compile("!{2,}"),
            Pattern.compile("\\?{2,}")
    );

    private static final Set<String> NEGATORS = Set.of(
            "not", "no", "never", "hardly", "don't", "didn't", "doesn't", "isn't", "wasn't", "aren't", "won't", "can't"
    );

    private final ModerationProperties props;
    private final ResourceLoader resourceLoader;

    private Set<String> profanity = Set.of();
    private Map<String, Double> polarity = Map.of();

    public LexiconRiskScorer(ModerationProperties props, ResourceLoader resourceLoader) {
        this.props = props;
        this.resourceLoader = resourceLoader;
    }

    @PostConstruct
    public void init() {
        Set<String> words = new HashSet<>();
        for (String line : readLines(props.getScorer().getProfanityList())) {
            words.add(line.toLowerCase(Locale.ROOT));
        }
        Map<String, Double> lexicon = new HashMap<>();
        for (String line : readLines(props.getScorer().getSentimentLexicon())) {
            String[] parts = line.split("\\s+");
            if (parts.length != 2) {
                log.warn("Skipping malformed sentiment lexicon line: {}", line);
                continue;
            }
            lexicon.put(parts[0].toLowerCase(Locale.ROOT), Double.parseDouble(parts[1]));
        }
        this.profanity = Set.copyOf(words);
        this.polarity = Map.copyOf(lexicon);
        log.info("Risk scorer loaded: {} profanity terms, {} sentiment terms", profanity.size(), polarity.size());
    }

    @Override
    public RiskAssessment score(String text) {
        if (text == null || text.isBlank()) {
            return RiskAssessment.clean();
        }
        List<String> tokens = tokenize(text);
        List<String> reasons = new ArrayList<>();

        List<String> profaneHits = tokens.stream().filter(profanity::contains).distinct().toList();
        boolean profane = !profaneHits.isEmpty();
        if (profane) {
            reasons.add("Contains profanity (" + profaneHits.size() + " term(s))");
        }

        double spam = spamLikelihood(text, tokens);
        if (spam >= props.getScorer().getSpamRuleThreshold()) {
            reasons.add(String.format(Locale.ROOT, "Detected as spam (score: %.2f)", spam));
        }

        double sentiment = sentiment(tokens);
        if (sentiment <= props.getScorer().getNegativityRuleThreshold()) {
            reasons.add(String.format(Locale.ROOT, "Extremely negative sentiment (score: %.2f)", sentiment));
        }

        var w = props.getScorer();
        double composite = w.getSpamWeight() * spam
                + w.getNegativityWeight() * Math.max(0.0, -sentiment)
                + (profane ? w.getProfanityWeight() : 0.0);
        composite = clamp(composite, 0.0, 1.0);

        return new RiskAssessment(profane, spam, sentiment, composite, List.copyOf(reasons), false);
    }

    public int profanityTermCount() {
        return profanity.size();
    }

    public int sentimentTermCount() {
        return polarity.size();
    }

    public int spamPatternCount() {
        return SPAM_PATTERNS.size();
    }

    double spamLikelihood(String text, List<String> tokens) {
        int indicators = 0;
        for (Pattern p : SPAM_PATTERNS) {
            if (p.matcher(text).find()) indicators++;
        }
        if (tokens.size() > 1) {
            double uniqueRatio = (double) new HashSet<>(tokens).size() / tokens.size();
            if (uniqueRatio < 0.3) indicators += 2;
        }
        long letters = text.chars().filter(Character::isLetter).count();
        long upper = text.chars().filter(Character::isUpperCase).count();
        if (letters > 0 && (double) upper / letters > 0.5) indicators++;

        return Math.min((double) indicators / (SPAM_PATTERNS.size() + 3), 1.0);
    }

    double sentiment(List<String> tokens) {
        double sum = 0.0;
        int matched = 0;
        for (int i = 0; i < tokens.size(); i++) {
            Double weight = polarity.get(tokens.get(i));
            if (weight == null) continue;
            if (i > 0 && NEGATORS.contains(tokens.get(i - 1))) {
                weight = -weight;
            }
            sum += weight;
            matched++;
        }
        return matched == 0 ? 0.0 : clamp(sum / matched, -1.0, 1.0);
    }

    private static List<String> tokenize(String text) {
        List<String> out = new ArrayList<>();
        Matcher m = TOKEN.matcher(text.toLowerCase(Locale.ROOT));
        while (m.find()) {
            out.add(m.group());
        }
        return out;
    }

    private List<String> readLines(String location) {
        Resource resource = resourceLoader.getResource(location);
        List<String> lines = new ArrayList<>();
        try (BufferedReader reader = new BufferedReader(new InputStreamReader(resource.getInputStream(), StandardCharsets.UTF_8))) {
            String line;
            while ((line = reader.readLine()) != null) {
                line = line.trim();
                if (!line.isEmpty() && !line.startsWith("#")) lines.add(line);
            }
        } catch (IOException e) {
            throw new UncheckedIOException("Lexicon could not be read: " + location, e);
        }
        return lines;
    }

    private static double clamp(double v, double min, double max) {
        if (v < min) return min;
        if (v > max) return max;
        return v;
    }
}
