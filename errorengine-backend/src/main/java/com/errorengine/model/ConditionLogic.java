package com.errorengine.model;

/**
 * How the conditions of a routing rule combine.
 */
public enum ConditionLogic {
    AND, OR
}
