package com.jay.underwriter.config;

import com.jay.underwriter.model.enums.ColumnType;

public record OutputColumn(String columnId, ColumnType type) {}
