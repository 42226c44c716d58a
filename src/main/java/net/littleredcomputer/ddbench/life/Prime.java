// Copyright 2018 Colin Smith. MIT License.
package net.littleredcomputer.ddbench.life;

/** Whether a cell is seen before (PRE) or after (POST) one step of the game. */
public enum Prime {
    PRE,
    POST,
}
