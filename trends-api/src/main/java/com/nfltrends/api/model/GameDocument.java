package com.nfltrends.api.model;

import org.springframework.data.annotation.Id;
import org.springframework.data.mongodb.core.mapping.Field;

/**
 * Read-only model of one completed game with its betting lines and derived outcome flags.
 */
@org.springframework.data.mongodb.core.mapping.Document(collection = "games")
public class GameDocument {

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
    @Field("home_score")
    private Integer homeScore;
    @Field("away_score")
    private Integer awayScore;
    @Field("combined_score")
    private Integer combinedScore;
    private Boolean tie;
    private String winner;
    private String loser;
    private Double spread;
    @Field("home_spread")
    private Double homeSpread;
    @Field("home_spread_result")
    private Integer homeSpreadResult;
    @Field("away_spread")
    private Double awaySpread;
    @Field("away_spread_result")
    private Integer awaySpreadResult;
    @Field("spread_push")
    private Boolean spreadPush;
    private Boolean pk;
    private Double total;
    @Field("total_push")
    private Boolean totalPush;
    @Field("home_favorite")
    private Boolean homeFavorite;
    @Field("away_favorite")
    private Boolean awayFavorite;
    @Field("home_underdog")
    private Boolean homeUnderdog;
    @Field("away_underdog")
    private Boolean awayUnderdog;
    @Field("home_win")
    private Boolean homeWin;
    @Field("away_win")
    private Boolean awayWin;
    @Field("favorite_win")
    private Boolean favoriteWin;
    @Field("underdog_win")
    private Boolean underdogWin;
    @Field("home_favorite_win")
    private Boolean homeFavoriteWin;
    @Field("away_favorite_win")
    private Boolean awayFavoriteWin;
    @Field("home_underdog_win")
    private Boolean homeUnderdogWin;
    @Field("away_underdog_win")
    private Boolean awayUnderdogWin;
    @Field("home_cover")
    private Boolean homeCover;
    @Field("away_cover")
    private Boolean awayCover;
    @Field("favorite_cover")
    private Boolean favoriteCover;
    @Field("underdog_cover")
    private Boolean underdogCover;
    @Field("home_favorite_cover")
    private Boolean homeFavoriteCover;
    @Field("away_favorite_cover")
    private Boolean awayFavoriteCover;
    @Field("home_underdog_cover")
    private Boolean homeUnderdogCover;
    @Field("away_underdog_cover")
    private Boolean awayUnderdogCover;
    @Field("over_hit")
    private Boolean overHit;
    @Field("under_hit")
    private Boolean underHit;

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
    public Integer getHomeScore() { return homeScore; }
    public Integer getAwayScore() { return awayScore; }
    public Integer getCombinedScore() { return combinedScore; }
    public Boolean getTie() { return tie; }
    public String getWinner() { return winner; }
    public String getLoser() { return loser; }
    public Double getSpread() { return spread; }
    public Double getHomeSpread() { return homeSpread; }
    public Integer getHomeSpreadResult() { return homeSpreadResult; }
    public Double getAwaySpread() { return awaySpread; }
    public Integer getAwaySpreadResult() { return awaySpreadResult; }
    public Boolean getSpreadPush() { return spreadPush; }
    public Boolean getPk() { return pk; }
    public Double getTotal() { return total; }
    public Boolean getTotalPush() { return totalPush; }
    public Boolean getHomeFavorite() { return homeFavorite; }
    public Boolean getAwayFavorite() { return awayFavorite; }
    public Boolean getHomeUnderdog() { return homeUnderdog; }
    public Boolean getAwayUnderdog() { return awayUnderdog; }
    public Boolean getHomeWin() { return homeWin; }
    public Boolean getAwayWin() { return awayWin; }
    public Boolean getFavoriteWin() { return favoriteWin; }
    public Boolean getUnderdogWin() { return underdogWin; }
    public Boolean getHomeFavoriteWin() { return homeFavoriteWin; }
    public Boolean getAwayFavoriteWin() { return awayFavoriteWin; }
    public Boolean getHomeUnderdogWin() { return homeUnderdogWin; }
    public Boolean getAwayUnderdogWin() { return awayUnderdogWin; }
    public Boolean getHomeCover() { return homeCover; }
    public Boolean getAwayCover() { return awayCover; }
    public Boolean getFavoriteCover() { return favoriteCover; }
    public Boolean getUnderdogCover() { return underdogCover; }
    public Boolean getHomeFavoriteCover() { return homeFavoriteCover; }
    public Boolean getAwayFavoriteCover() { return awayFavoriteCover; }
    public Boolean getHomeUnderdogCover() { return homeUnderdogCover; }
    public Boolean getAwayUnderdogCover() { return awayUnderdogCover; }
    public Boolean getOverHit() { return overHit; }
    public Boolean getUnderHit() { return underHit; }
}
