package com.nfltrends.api.model;

import org.springframework.data.annotation.Id;
import org.springframework.data.mongodb.core.mapping.Field;

/**
 * Columns shared by historical and weekly trends. {@code spread} and {@code total} hold graded
 * labels such as {@code "3.0"} or {@code "45 or less"}; a null column means the trend is not
 * restricted on that dimension.
 */
public abstract class BaseTrendDocument {

    @Id
    private String id;
    @Field("id_string")
    private String idString;
    private String category;
    private String month;
    @Field("day_of_week")
    private String dayOfWeek;
    private Boolean divisional;
    private String spread;
    private String total;
    private String seasons;
    private Integer wins;
    private Integer losses;
    private Integer pushes;
    @Field("total_games")
    private Integer totalGames;
    @Field("win_percentage")
    private Double winPercentage;
    @Field("trend_string")
    private String trendString;

    // Getters only (read-only)
    public String getId() { return id; }
    public String getIdString() { return idString; }
    public String getCategory() { return category; }
    public String getMonth() { return month; }
    public String getDayOfWeek() { return dayOfWeek; }
    public Boolean getDivisional() { return divisional; }
    public String getSpread() { return spread; }
    public String getTotal() { return total; }
    public String getSeasons() { return seasons; }
    public Integer getWins() { return wins; }
    public Integer getLosses() { return losses; }
    public Integer getPushes() { return pushes; }
    public Integer getTotalGames() { return totalGames; }
    public Double getWinPercentage() { return winPercentage; }
    public String getTrendString() { return trendString; }
}
