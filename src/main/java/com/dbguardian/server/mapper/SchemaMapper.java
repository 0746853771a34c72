package com.dbguardian.server.mapper;

import org.apache.ibatis.annotations.Mapper;
import org.apache.ibatis.annotations.Param;
import org.apache.ibatis.annotations.Select;
import org.apache.ibatis.annotations.Update;

/**
 * DDL for the tables the engine owns, plus the PL/pgSQL hook that publishes schedule
 * changes on the {@code schedule_changes} channel.
 */
@Mapper
public interface SchemaMapper {

    @Update("""
            CREATE TABLE IF NOT EXISTS backup_schedules (
                id SERIAL PRIMARY KEY,
                database_name VARCHAR(255) NOT NULL,
                schedule_type VARCHAR(50) NOT NULL,
                interval_minutes INTEGER,
                cron_expression VARCHAR(255),
                enabled BOOLEAN DEFAULT TRUE,
                created_at TIMESTAMP DEFAULT CURRENT_TIMESTAMP,
                last_run TIMESTAMP,
                next_run TIMESTAMP
            )
            """)
    void createScheduleTable();

    @Update("""
            CREATE TABLE IF NOT EXISTS backups (
                id SERIAL PRIMARY KEY,
                database_name VARCHAR(255) NOT NULL,
                backup_name VARCHAR(255) NOT NULL,
                storage_type VARCHAR(50) NOT NULL,
                storage_location TEXT NOT NULL,
                created_at TIMESTAMP DEFAULT CURRENT_TIMESTAMP,
                size_bytes BIGINT,
                status VARCHAR(50) DEFAULT 'completed'
            )
            """)
    void createBackupTable();

    @Update("""
            CREATE TABLE IF NOT EXISTS database_credentials (
                id SERIAL PRIMARY KEY,
                name VARCHAR(255) UNIQUE NOT NULL,
                host VARCHAR(255) NOT NULL,
                port INTEGER DEFAULT 5432,
                database VARCHAR(255) NOT NULL,
                username VARCHAR(255) NOT NULL,
                password TEXT NOT NULL,
                version VARCHAR(50),
                created_at TIMESTAMP DEFAULT CURRENT_TIMESTAMP
            )
            """)
    void createCredentialTable();

    // updates that only touch last_run / next_run are bookkeeping and stay silent
    @Update("""
            CREATE OR REPLACE FUNCTION notify_schedule_change()
            RETURNS TRIGGER AS $$
            DECLARE
                payload JSON;
            BEGIN
                IF TG_OP = 'INSERT' THEN
                    payload := json_build_object(
                        'action', 'inserted',
                        'schedule_id', NEW.id,
                        'database_name', NEW.database_name,
                        'enabled', NEW.enabled
                    );
                ELSIF TG_OP = 'UPDATE' THEN
                    IF NEW.database_name IS NOT DISTINCT FROM OLD.database_name
                        AND NEW.schedule_type IS NOT DISTINCT FROM OLD.schedule_type
                        AND NEW.interval_minutes IS NOT DISTINCT FROM OLD.interval_minutes
                        AND NEW.cron_expression IS NOT DISTINCT FROM OLD.cron_expression
                        AND NEW.enabled IS NOT DISTINCT FROM OLD.enabled THEN
                        RETURN NEW;
                    END IF;
                    payload := json_build_object(
                        'action', 'updated',
                        'schedule_id', NEW.id,
                        'database_name', NEW.database_name,
                        'enabled', NEW.enabled,
                        'old_enabled', OLD.enabled
                    );
                ELSIF TG_OP = 'DELETE' THEN
                    payload := json_build_object(
                        'action', 'deleted',
                        'schedule_id', OLD.id,
                        'database_name', OLD.database_name,
                        'enabled', OLD.enabled
                    );
                END IF;

                PERFORM pg_notify('schedule_changes', payload::text);

                IF TG_OP = 'DELETE' THEN
                    RETURN OLD;
                END IF;
                RETURN NEW;
            END;
            $$ LANGUAGE plpgsql
            """)
    void createNotifyFunction();

    @Select("SELECT EXISTS (SELECT 1 FROM pg_trigger WHERE tgname = #{triggerName})")
    boolean isTriggerExist(@Param("triggerName") String triggerName);

    @Update("""
            CREATE TRIGGER schedule_change_trigger
                AFTER INSERT OR UPDATE OR DELETE ON backup_schedules
                FOR EACH ROW EXECUTE FUNCTION notify_schedule_change()
            """)
    void createNotifyTrigger();
}
