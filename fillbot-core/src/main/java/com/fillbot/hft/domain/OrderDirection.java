package com.fillbot.hft.domain;

public enum OrderDirection {
  LONG,
  SHORT,
}
