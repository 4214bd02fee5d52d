package com.example.tokenauth.entity;

public enum TokenKind {
    ACCESS,
    REFRESH
}
