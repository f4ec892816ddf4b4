package com.cafepos.menu.entity;

public enum DietType {
    VEGAN,
    VEG,
    EGGETARIAN,
    NON_VEG
}
