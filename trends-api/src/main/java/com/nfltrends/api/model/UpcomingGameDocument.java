package com.nfltrends.api.model;

import org.springframework.data.annotation.Id;
import org.springframework.data.mongodb.core.mapping.Field;

/**
 * Read-only model of a scheduled game with its current lines.
 */
@org.springframework.data.mongodb.core.mapping.Document(collection = "upcoming_games")
public class UpcomingGameDocument {

    @Id
    private String id;
    @Field("id_string")
    private String idString;
    private String date;
    private String month;
    private Integer day;
    private Integer year;
    private String season;
    @Field("day_of_week")
    private String dayOfWeek;
    @Field("home_team")
    private String homeTeam;
    @Field("home_abbreviation")
    private String homeAbbreviation;
    @Field("home_division")
    private String homeDivision;
    @Field("away_team")
    private String awayTeam;
    @Field("away_abbreviation")
    private String awayAbbreviation;
    @Field("away_division")
    private String awayDivision;
    private Boolean divisional;
    private Double spread;
    @Field("home_spread")
    private Double homeSpread;
    @Field("home_spread_odds")
    private Integer homeSpreadOdds;
    @Field("away_spread")
    private Double awaySpread;
    @Field("away_spread_odds")
    private Integer awaySpreadOdds;
    @Field("home_moneyline_odds")
    private Integer homeMoneylineOdds;
    @Field("away_moneyline_odds")
    private Integer awayMoneylineOdds;
    private Double total;
    private Double over;
    @Field("over_odds")
    private Integer overOdds;
    private Double under;
    @Field("under_odds")
    private Integer underOdds;

    // Getters only (read-only)
    public String getId() { return id; }
    public String getIdString() { return idString; }
    public String getDate() { return date; }
    public String getMonth() { return month; }
    public Integer getDay() { return day; }
    public Integer getYear() { return year; }
    public String getSeason() { return season; }
    public String getDayOfWeek() { return dayOfWeek; }
    public String getHomeTeam() { return homeTeam; }
    public String getHomeAbbreviation() { return homeAbbreviation; }
    public String getHomeDivision() { return homeDivision; }
    public String getAwayTeam() { return awayTeam; }
    public String getAwayAbbreviation() { return awayAbbreviation; }
    public String getAwayDivision() { return awayDivision; }
    public Boolean getDivisional() { return divisional; }
    public Double getSpread() { return spread; }
    public Double getHomeSpread() { return homeSpread; }
    public Integer getHomeSpreadOdds() { return homeSpreadOdds; }
    public Double getAwaySpread() { return awaySpread; }
    public Integer getAwaySpreadOdds() { return awaySpreadOdds; }
    public Integer getHomeMoneylineOdds() { return homeMoneylineOdds; }
    public Integer getAwayMoneylineOdds() { return awayMoneylineOdds; }
    public Double getTotal() { return total; }
    public Double getOver() { return over; }
    public Integer getOverOdds() { return overOdds; }
    public Double getUnder() { return under; }
    public Integer getUnderOdds() { return underOdds; }
}
