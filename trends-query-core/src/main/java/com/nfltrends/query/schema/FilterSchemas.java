package com.nfltrends.query.schema;

import com.nfltrends.query.ordinal.CategoricalOrdinal;
import com.nfltrends.query.schema.domain.BooleanDomain;
import com.nfltrends.query.schema.domain.DecimalDomain;
import com.nfltrends.query.schema.domain.IntegerDomain;
import com.nfltrends.query.schema.domain.LabelDomain;
import com.nfltrends.query.schema.domain.PatternDomain;
import com.nfltrends.query.sort.SortKey;
import com.nfltrends.query.sort.SortSpec;

import java.time.LocalDate;
import java.time.format.DateTimeParseException;
import java.util.ArrayList;
import java.util.List;
import java.util.Locale;
import java.util.Optional;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

/**
 * Filter catalogs of the three queryable record kinds.
 */
public final class FilterSchemas {

    public static final String GAMES_KIND = "games";
    public static final String TRENDS_KIND = "trends";
    public static final String WEEKLY_TRENDS_KIND = "weekly_trends";

    public static final LabelDomain MONTHS = LabelDomain.of("month name", CategoricalOrdinal.MONTHS.labels());
    public static final LabelDomain WEEKDAYS = LabelDomain.of("day of week", CategoricalOrdinal.WEEKDAYS.labels());
    public static final LabelDomain TEAM_NAMES = LabelDomain.of("full team name", NflTeam.fullNames());
    public static final LabelDomain TEAM_ABBREVIATIONS = LabelDomain.of("team abbreviation", NflTeam.abbreviations());
    public static final LabelDomain DIVISIONS = LabelDomain.of("division", Division.labels());
    public static final LabelDomain CATEGORIES = LabelDomain.of("trend category", TrendCategory.labels());
    public static final LabelDomain SEASONS_SINCE = LabelDomain.of("season", CategoricalOrdinal.SEASONS_SINCE.labels());
    public static final LabelDomain SPREAD_LABELS = LabelDomain.of("spread", spreadLabels());
    public static final LabelDomain TOTAL_LABELS = LabelDomain.of("total", totalLabels());

    public static final int FIRST_SEASON = 2006;
    public static final int LAST_SEASON = 2024;

    private static final List<String> GAME_FLAGS = List.of(
            "divisional", "tie", "spread_push", "pk", "total_push",
            "home_favorite", "away_favorite", "home_underdog", "away_underdog",
            "home_win", "away_win", "favorite_win", "underdog_win",
            "home_favorite_win", "away_favorite_win", "home_underdog_win", "away_underdog_win",
            "home_cover", "away_cover", "favorite_cover", "underdog_cover",
            "home_favorite_cover", "away_favorite_cover", "home_underdog_cover", "away_underdog_cover",
            "over_hit", "under_hit");

    public static final FilterSchema GAMES = games();
    public static final FilterSchema TRENDS = trends(TRENDS_KIND, false);
    public static final FilterSchema WEEKLY_TRENDS = trends(WEEKLY_TRENDS_KIND, true);

    private FilterSchemas() {
    }

    public static FilterSchema forKind(String kind) {
        switch (kind) {
            case GAMES_KIND:
                return GAMES;
            case TRENDS_KIND:
                return TRENDS;
            case WEEKLY_TRENDS_KIND:
                return WEEKLY_TRENDS;
            default:
                throw new IllegalArgumentException("Unknown record kind: " + kind);
        }
    }

    // ============ GAMES ============

    private static FilterSchema games() {
        FilterSchema.Builder builder = FilterSchema.builder(GAMES_KIND)
                .field(FieldDefinition.values("game_id", gameId()).column("id_string"))
                .field(FieldDefinition.values("date", date()).withStartEnd())
                .field(FieldDefinition.values("month", MONTHS).withStartEnd().ordinal(CategoricalOrdinal.MONTHS))
                .field(FieldDefinition.values("day", IntegerDomain.between(1, 31)).withStartEnd())
                .field(FieldDefinition.values("year", IntegerDomain.between(2006, 2025)).withStartEnd())
                .field(FieldDefinition.values("season", season()).withStartEnd())
                .field(FieldDefinition.values("day_of_week", WEEKDAYS))
                .field(FieldDefinition.values("home_team", TEAM_NAMES))
                .field(FieldDefinition.values("away_team", TEAM_NAMES))
                .field(FieldDefinition.values("home_abbreviation", TEAM_ABBREVIATIONS))
                .field(FieldDefinition.values("away_abbreviation", TEAM_ABBREVIATIONS))
                .field(FieldDefinition.values("home_division", DIVISIONS))
                .field(FieldDefinition.values("away_division", DIVISIONS))
                .field(FieldDefinition.values("home_score", IntegerDomain.between(0, 100)).withMinMax())
                .field(FieldDefinition.values("away_score", IntegerDomain.between(0, 100)).withMinMax())
                .field(FieldDefinition.values("combined_score", IntegerDomain.between(0, 200)).withMinMax())
                .field(FieldDefinition.values("winner", TEAM_NAMES))
                .field(FieldDefinition.values("loser", TEAM_NAMES))
                .field(FieldDefinition.values("spread", DecimalDomain.halfPoints("0", "27")).withMinMax())
                .field(FieldDefinition.values("home_spread", DecimalDomain.halfPoints("-27", "27")).withMinMax())
                .field(FieldDefinition.values("home_spread_result", IntegerDomain.between(-100, 100)).withMinMax())
                .field(FieldDefinition.values("away_spread", DecimalDomain.halfPoints("-27", "27")).withMinMax())
                .field(FieldDefinition.values("away_spread_result", IntegerDomain.between(-100, 100)).withMinMax())
                .field(FieldDefinition.values("total", DecimalDomain.halfPoints("0", "100")).withMinMax());
        for (String flag : GAME_FLAGS) {
            builder.field(FieldDefinition.flag(flag, BooleanDomain.STRICT));
        }

        List<String> columns = new ArrayList<>(List.of(
                "id", "id_string", "date", "month", "day", "year", "season", "day_of_week",
                "home_team", "home_abbreviation", "home_division",
                "away_team", "away_abbreviation", "away_division",
                "home_score", "away_score", "combined_score", "winner", "loser",
                "spread", "home_spread", "home_spread_result", "away_spread", "away_spread_result", "total"));
        columns.addAll(GAME_FLAGS);

        return builder
                .matchup("home_team", "away_team")
                .matchup("home_abbreviation", "away_abbreviation")
                .matchup("winner", "loser")
                .sortable(columns.toArray(new String[0]))
                .sortOrdinal("month", CategoricalOrdinal.MONTHS)
                .sortOrdinal("day_of_week", CategoricalOrdinal.WEEKDAYS)
                .defaultSort(SortSpec.of(SortKey.asc("date"), SortKey.asc("id_string")))
                .limits(100, 1000)
                .build();
    }

    // ============ TRENDS ============

    private static FilterSchema trends(String kind, boolean weekly) {
        FilterSchema.Builder builder = FilterSchema.builder(kind)
                .field(FieldDefinition.values("trend_id", trendId()).column("id_string"))
                .field(FieldDefinition.values("category", CATEGORIES))
                .field(FieldDefinition.values("month", MONTHS).nullable().withStartEnd().ordinal(CategoricalOrdinal.MONTHS))
                .field(FieldDefinition.values("day_of_week", WEEKDAYS).nullable())
                .field(FieldDefinition.flag("divisional", BooleanDomain.LENIENT).nullable())
                .field(FieldDefinition.graded("spread", SPREAD_LABELS, IntegerDomain.between(1, 14)))
                .field(FieldDefinition.graded("total", TOTAL_LABELS, new IntegerDomain(30, 60, 5)))
                .field(FieldDefinition.since("seasons", SEASONS_SINCE, CategoricalOrdinal.SEASONS_SINCE))
                .field(FieldDefinition.values("wins", IntegerDomain.between(1, 5000)).withMinMax())
                .field(FieldDefinition.values("losses", IntegerDomain.between(1, 5000)).withMinMax())
                .field(FieldDefinition.values("pushes", IntegerDomain.between(1, 5000)).withMinMax())
                .field(FieldDefinition.values("total_games", IntegerDomain.between(1, 10000)).withMinMax())
                .field(FieldDefinition.values("win_percentage", DecimalDomain.between("0", "100")).withMinMax());

        List<String> columns = new ArrayList<>(List.of(
                "id", "id_string", "category", "month", "day_of_week", "divisional", "spread", "total",
                "seasons", "wins", "losses", "pushes", "total_games", "win_percentage", "trend_string"));
        if (weekly) {
            builder.field(FieldDefinition.gamesApplicable("games_applicable", matchupString()));
        }

        return builder
                .sortable(columns.toArray(new String[0]))
                .sortOrdinal("month", CategoricalOrdinal.MONTHS)
                .sortOrdinal("day_of_week", CategoricalOrdinal.WEEKDAYS)
                .defaultSort(SortSpec.of(SortKey.desc("win_percentage"), SortKey.desc("total_games")))
                .limits(5000, 5_000_000)
                .build();
    }

    // ============ DOMAINS ============

    private static PatternDomain gameId() {
        return PatternDomain.matching("home + away abbreviation + yyyymmdd, e.g. PHIDAL20240905",
                "^[A-Za-z]{2,3}[A-Za-z]{2,3}\\d{8}$").upperCased();
    }

    private static PatternDomain date() {
        return PatternDomain.matching("date as yyyy-mm-dd", "^\\d{4}-\\d{2}-\\d{2}$")
                .withRule(value -> {
                    try {
                        LocalDate.parse(value);
                        return Optional.empty();
                    } catch (DateTimeParseException e) {
                        return Optional.of(value + " is not a calendar date");
                    }
                });
    }

    private static PatternDomain season() {
        return PatternDomain.matching("season as yyyy-yyyy between " + FIRST_SEASON + "-" + (FIRST_SEASON + 1)
                        + " and " + LAST_SEASON + "-" + (LAST_SEASON + 1), "^\\d{4}-\\d{4}$")
                .withRule(value -> {
                    int start = Integer.parseInt(value.substring(0, 4));
                    int end = Integer.parseInt(value.substring(5));
                    if (end != start + 1) {
                        return Optional.of("the second year must be exactly one more than the first");
                    }
                    if (start < FIRST_SEASON || start > LAST_SEASON) {
                        return Optional.of("season must start between " + FIRST_SEASON + " and " + LAST_SEASON);
                    }
                    return Optional.empty();
                });
    }

    private static PatternDomain trendId() {
        return PatternDomain.matching("7 comma separated parts: category,month,day of week,divisional,"
                + "spread,total,seasons since", "^[^,]*(,[^,]*){6}$");
    }

    private static PatternDomain matchupString() {
        Pattern pattern = Pattern.compile("^([A-Za-z]{2,3})[vV][sS]([A-Za-z]{2,3})$");
        return new PatternDomain("HOMEvsAWAY using team abbreviations, e.g. PHIvsDAL", pattern,
                value -> {
                    Matcher matcher = pattern.matcher(value);
                    matcher.matches();
                    return matcher.group(1).toUpperCase(Locale.ROOT) + "vs" + matcher.group(2).toUpperCase(Locale.ROOT);
                },
                value -> {
                    int separator = value.indexOf("vs");
                    String home = value.substring(0, separator);
                    String away = value.substring(separator + 2);
                    if (!TEAM_ABBREVIATIONS.labels().contains(home) || !TEAM_ABBREVIATIONS.labels().contains(away)) {
                        return Optional.of(value + " does not name two known team abbreviations");
                    }
                    return Optional.empty();
                });
    }

    private static List<String> spreadLabels() {
        List<String> labels = new ArrayList<>();
        for (int halfPoints = 0; halfPoints <= 54; halfPoints++) {
            labels.add(halfPoints / 2 + (halfPoints % 2 == 0 ? ".0" : ".5"));
        }
        for (int points = 1; points <= 14; points++) {
            labels.add(points + " or less");
            labels.add(points + " or more");
        }
        return labels;
    }

    private static List<String> totalLabels() {
        List<String> labels = new ArrayList<>();
        for (int points = 30; points <= 60; points += 5) {
            labels.add(points + " or less");
            labels.add(points + " or more");
        }
        return labels;
    }
}
