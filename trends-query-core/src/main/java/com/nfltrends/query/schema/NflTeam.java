package com.nfltrends.query.schema;

import java.util.ArrayList;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Set;

/**
 * Every franchise name that appears in the historical data set, including relocated and
 * renamed teams, with the abbreviation and division it played under.
 */
public enum NflTeam {

    ARIZONA_CARDINALS("Arizona Cardinals", "ARI", Division.NFC_WEST),
    ATLANTA_FALCONS("Atlanta Falcons", "ATL", Division.NFC_SOUTH),
    BALTIMORE_RAVENS("Baltimore Ravens", "BAL", Division.AFC_NORTH),
    BUFFALO_BILLS("Buffalo Bills", "BUF", Division.AFC_EAST),
    CAROLINA_PANTHERS("Carolina Panthers", "CAR", Division.NFC_SOUTH),
    CHICAGO_BEARS("Chicago Bears", "CHI", Division.NFC_NORTH),
    CINCINNATI_BENGALS("Cincinnati Bengals", "CIN", Division.AFC_NORTH),
    CLEVELAND_BROWNS("Cleveland Browns", "CLE", Division.AFC_NORTH),
    DALLAS_COWBOYS("Dallas Cowboys", "DAL", Division.NFC_EAST),
    DENVER_BRONCOS("Denver Broncos", "DEN", Division.AFC_WEST),
    DETROIT_LIONS("Detroit Lions", "DET", Division.NFC_NORTH),
    GREEN_BAY_PACKERS("Green Bay Packers", "GB", Division.NFC_NORTH),
    HOUSTON_TEXANS("Houston Texans", "HOU", Division.AFC_SOUTH),
    INDIANAPOLIS_COLTS("Indianapolis Colts", "IND", Division.AFC_SOUTH),
    JACKSONVILLE_JAGUARS("Jacksonville Jaguars", "JAX", Division.AFC_SOUTH),
    KANSAS_CITY_CHIEFS("Kansas City Chiefs", "KC", Division.AFC_WEST),
    LAS_VEGAS_RAIDERS("Las Vegas Raiders", "LV", Division.AFC_WEST),
    OAKLAND_RAIDERS("Oakland Raiders", "OAK", Division.AFC_WEST),
    LOS_ANGELES_CHARGERS("Los Angeles Chargers", "LAC", Division.AFC_WEST),
    SAN_DIEGO_CHARGERS("San Diego Chargers", "SD", Division.AFC_WEST),
    LOS_ANGELES_RAMS("Los Angeles Rams", "LAR", Division.NFC_WEST),
    ST_LOUIS_RAMS("St. Louis Rams", "STL", Division.NFC_WEST),
    MIAMI_DOLPHINS("Miami Dolphins", "MIA", Division.AFC_EAST),
    MINNESOTA_VIKINGS("Minnesota Vikings", "MIN", Division.NFC_NORTH),
    NEW_ENGLAND_PATRIOTS("New England Patriots", "NE", Division.AFC_EAST),
    NEW_ORLEANS_SAINTS("New Orleans Saints", "NO", Division.NFC_SOUTH),
    NEW_YORK_GIANTS("New York Giants", "NYG", Division.NFC_EAST),
    NEW_YORK_JETS("New York Jets", "NYJ", Division.AFC_EAST),
    PHILADELPHIA_EAGLES("Philadelphia Eagles", "PHI", Division.NFC_EAST),
    PITTSBURGH_STEELERS("Pittsburgh Steelers", "PIT", Division.AFC_NORTH),
    SAN_FRANCISCO_49ERS("San Francisco 49ers", "SF", Division.NFC_WEST),
    SEATTLE_SEAHAWKS("Seattle Seahawks", "SEA", Division.NFC_WEST),
    TAMPA_BAY_BUCCANEERS("Tampa Bay Buccaneers", "TB", Division.NFC_SOUTH),
    TENNESSEE_TITANS("Tennessee Titans", "TEN", Division.AFC_SOUTH),
    WASHINGTON_COMMANDERS("Washington Commanders", "WAS", Division.NFC_EAST),
    WASHINGTON_FOOTBALL_TEAM("Washington Football Team", "WAS", Division.NFC_EAST),
    WASHINGTON_REDSKINS("Washington Redskins", "WAS", Division.NFC_EAST);

    private final String fullName;
    private final String abbreviation;
    private final Division division;

    NflTeam(String fullName, String abbreviation, Division division) {
        this.fullName = fullName;
        this.abbreviation = abbreviation;
        this.division = division;
    }

    public String fullName() {
        return fullName;
    }

    public String abbreviation() {
        return abbreviation;
    }

    public Division division() {
        return division;
    }

    public static List<String> fullNames() {
        List<String> names = new ArrayList<>();
        for (NflTeam team : values()) {
            names.add(team.fullName);
        }
        return names;
    }

    public static List<String> abbreviations() {
        Set<String> abbreviations = new LinkedHashSet<>();
        for (NflTeam team : values()) {
            abbreviations.add(team.abbreviation);
        }
        return new ArrayList<>(abbreviations);
    }
}
