package com.clubcricket.scorebook.dto;

import java.util.List;

public record FullScorecard(MatchListItem match, List<InningsScorecard> innings) {}
