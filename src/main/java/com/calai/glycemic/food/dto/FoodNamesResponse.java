package com.calai.glycemic.food.dto;

import java.util.List;

public record FoodNamesResponse(int count, List<String> names) {}
