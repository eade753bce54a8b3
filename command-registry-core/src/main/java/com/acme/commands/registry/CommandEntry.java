package com.acme.commands.registry;

/**
 * A value stored in the command table: either a terminal {@link CommandRef} or a {@link
 * CommandGroup} of further entries.
 */
public sealed interface CommandEntry permits CommandRef, CommandGroup {}
