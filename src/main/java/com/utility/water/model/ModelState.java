package com.utility.water.model;

public enum ModelState {
    UNINITIALIZED,
    TRAINED
}
